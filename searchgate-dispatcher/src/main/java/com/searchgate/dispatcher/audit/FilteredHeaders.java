package com.searchgate.dispatcher.audit;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 请求头过滤结果：实际转发的头部及其名称、被丢弃的头部名称。
 */
@Value
public class FilteredHeaders {

    Map<String, String> forwarded;
    List<String> forwardedNames;
    List<String> droppedNames;
}

package com.searchgate.dispatcher.audit;

import com.searchgate.data.entity.ResultStatus;
import lombok.Value;

@Value
public class Classification {

    ResultStatus result;

    /** 响应体中的结构化状态码，没有时为 null */
    Integer upstreamStatus;

    String errorMessage;
}

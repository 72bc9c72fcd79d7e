package com.searchgate.web.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class BatchAddKeysRequest {

    private List<String> apiKeys = new ArrayList<>();
}

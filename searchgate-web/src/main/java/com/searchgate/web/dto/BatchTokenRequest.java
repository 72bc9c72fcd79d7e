package com.searchgate.web.dto;

import lombok.Data;

@Data
public class BatchTokenRequest {

    private String group;
    private int count = 1;
    private String note;
}

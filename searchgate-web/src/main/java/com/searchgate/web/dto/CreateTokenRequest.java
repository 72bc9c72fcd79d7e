package com.searchgate.web.dto;

import lombok.Data;

@Data
public class CreateTokenRequest {

    private String note;
    private String group;
    private Long hourlyLimit;
    private Long dailyLimit;
    private Long monthlyLimit;
}

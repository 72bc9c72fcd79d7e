package com.searchgate.web.dto;

import lombok.Data;

@Data
public class EnqueueJobRequest {

    private String type;
    private String keyId;
}

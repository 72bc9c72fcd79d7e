package com.searchgate.web.dto;

import lombok.Data;

@Data
public class AddKeyRequest {

    private String apiKey;
}

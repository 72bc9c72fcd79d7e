package com.searchgate.web.dto;

import lombok.Data;

@Data
public class NoteRequest {

    private String note;
}

package com.searchgate.dispatcher.token;

import lombok.Value;

@Value
public class TokenGroupView {

    String name;
    long tokenCount;
    Long latestCreatedAt;
}

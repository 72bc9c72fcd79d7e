package com.searchgate.dispatcher.token;

import lombok.Value;

/**
 * 新签发（或轮换后）的令牌，token 为完整的 Bearer 串，只在签发时返回。
 */
@Value
public class IssuedToken {

    String tokenId;
    String token;
}

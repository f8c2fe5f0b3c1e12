// ILoginTransport.java
package com.authprobe.core.api;

import com.authprobe.core.model.LoginResponse;

/** 전송 최소 계약: 자격증명을 제출하고 응답 모델을 돌려준다. 구현은 스레드 세이프해야 한다. */
@FunctionalInterface
public interface ILoginTransport extends AutoCloseable {
    LoginResponse submit(String username, String password) throws TransportException;
    @Override default void close() throws Exception {}
}

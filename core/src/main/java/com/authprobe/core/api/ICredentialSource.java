// ICredentialSource.java
package com.authprobe.core.api;

import com.authprobe.core.model.Credential;

import java.io.IOException;
import java.util.stream.Stream;

/**
 * 자격증명 소스 최소 계약: open()마다 처음부터 다시 읽는 lazy 스트림.
 * 스트림은 단일 패스이며 호출자가 close 한다.
 */
@FunctionalInterface
public interface ICredentialSource {
    Stream<Credential> open() throws IOException;
}

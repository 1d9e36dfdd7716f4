package com.mythos.api.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ClientIdentityResolver")
class ClientIdentityResolverTest {

    @Test
    @DisplayName("X-Forwarded-For 첫 항목 우선")
    void prefersFirstForwardedAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", " 203.0.113.9 , 10.0.0.1");
        request.setRemoteAddr("10.0.0.2");

        assertThat(ClientIdentityResolver.resolve(request)).isEqualTo("203.0.113.9");
    }

    @Test
    @DisplayName("헤더가 없으면 remote address")
    void fallsBackToRemoteAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("10.0.0.2");

        assertThat(ClientIdentityResolver.resolve(request)).isEqualTo("10.0.0.2");
    }

    @Test
    @DisplayName("둘 다 없으면 unknown")
    void unknownWhenNothingAvailable() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("");

        assertThat(ClientIdentityResolver.resolve(request)).isEqualTo(ClientIdentityResolver.UNKNOWN);
    }
}

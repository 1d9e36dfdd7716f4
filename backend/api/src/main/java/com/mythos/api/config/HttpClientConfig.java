package com.mythos.api.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * HTTP 클라이언트 공통 설정
 * - WebClient.Builder: 모델 제공자 호출용 (connect timeout, response timeout)
 * - ObjectMapper: JSON 직렬화/역직렬화 설정
 *
 * 각 서비스에서 생성자 주입으로 사용
 */
@Configuration
public class HttpClientConfig {

    @Value("${mythos.provider.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${mythos.provider.timeout-ms:30000}")
    private long responseTimeoutMs;

    /**
     * 제공자 호출용 WebClient.Builder
     * - Connection Timeout: 10초
     * - Response Timeout: mythos.provider.timeout-ms (기본 30초)
     */
    @Bean
    @Primary
    public WebClient.Builder providerWebClientBuilder() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .responseTimeout(Duration.ofMillis(responseTimeoutMs));

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024));
    }

    /**
     * ObjectMapper Bean (싱글톤)
     * - 알 수 없는 속성 무시 (모델 응답에 여분 필드가 섞여도 파싱)
     * - Java 8 날짜/시간 지원
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        return mapper;
    }
}

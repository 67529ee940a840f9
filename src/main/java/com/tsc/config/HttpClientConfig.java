package com.tsc.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpClientConfig {

    private final SslCommerzProperties properties;

    public HttpClientConfig(SslCommerzProperties properties) {
        this.properties = properties;
    }

    @Bean("gatewayRestTemplate")
    public RestTemplate gatewayRestTemplate() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getConnectTimeout());
        factory.setReadTimeout(properties.getReadTimeout());

        return new RestTemplate(factory);
    }
}

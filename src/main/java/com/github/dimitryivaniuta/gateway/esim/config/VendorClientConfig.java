package com.github.dimitryivaniuta.gateway.esim.config;

import java.net.http.HttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client used for the vendor API.
 */
@Configuration
public class VendorClientConfig {

    /**
     * RestClient bound to the vendor base URL with connect/read timeouts applied.
     *
     * @param builder Boot-configured builder
     * @param props application properties
     * @return vendor rest client
     */
    @Bean
    public RestClient vendorRestClient(RestClient.Builder builder, AppProperties props) {
        AppProperties.Vendor vendor = props.getVendor();

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(vendor.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(vendor.getReadTimeout());

        return builder
                .baseUrl(vendor.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }
}

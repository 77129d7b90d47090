package tech.yump.configserver.http;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.web.client.DefaultResponseErrorHandler;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import tech.yump.configserver.exceptions.ConfigServerTransportException;

import java.util.List;
import java.util.Map;

/**
 * {@link ConfigServerHttpClient} backed by a {@link RestTemplate} whose root URI points at the config server.
 * Names are appended to {@value #DATA_PATH}.
 */
@Slf4j
public class RestTemplateConfigServerHttpClient implements ConfigServerHttpClient {

    static final String DATA_PATH = "/v1/data";

    private final RestTemplate restTemplate;

    public RestTemplateConfigServerHttpClient(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
        // Statuses are interpreted by the gateway.
        this.restTemplate.setErrorHandler(new PassThroughErrorHandler());
    }

    @Override
    public ConfigServerResponse get(String name) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return exchange(HttpMethod.GET, name, new HttpEntity<>(headers));
    }

    @Override
    public ConfigServerResponse post(String name, Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return exchange(HttpMethod.POST, name, new HttpEntity<>(body, headers));
    }

    private ConfigServerResponse exchange(HttpMethod method, String name, HttpEntity<?> entity) {
        String path = DATA_PATH + name;
        log.debug("Sending {} {} to config server", method, path);
        try {
            ResponseEntity<String> response = restTemplate.exchange(path, method, entity, String.class);
            log.debug("Config server answered {} {} with status {}", method, path, response.getStatusCode().value());
            return new ConfigServerResponse(response.getStatusCode().value(), response.getBody());
        } catch (RestClientException e) {
            log.error("Failed to reach config server for {} {}: {}", method, path, e.getMessage(), e);
            throw new ConfigServerTransportException("Failed to reach config server for name: " + name, e);
        }
    }

    private static final class PassThroughErrorHandler extends DefaultResponseErrorHandler {
        @Override
        public boolean hasError(@NonNull ClientHttpResponse response) {
            return false;
        }
    }
}

package com.infrastructure.api;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs against the embedded servlet container, since only a real multipart resolver enforces the size limit.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ProjectImportUploadLimitTest {

    private static final int FIVE_MEGABYTES = 5 * 1024 * 1024;

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void fileOverFiveMegabytesIsRejected() {
        byte[] content = new byte[FIVE_MEGABYTES + 64 * 1024];
        Arrays.fill(content, (byte) ' ');

        ResponseEntity<JsonNode> response = upload("huge.json", content);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().path("error").asText()).isEqualTo("File too large. Maximum size is 5MB");
    }

    @Test
    void fileWithinLimitReachesTheImport() {
        ResponseEntity<JsonNode> response = upload("empty.json", "{\"projects\":[]}".getBytes());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().path("error").asText()).isEqualTo("No valid projects found in file");
    }

    private ResponseEntity<JsonNode> upload(String filename, byte[] content) {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new ByteArrayResource(content) {
            @Override
            public String getFilename() {
                return filename;
            }
        });
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        return restTemplate.postForEntity("/api/projects/import", new HttpEntity<>(body, headers), JsonNode.class);
    }
}

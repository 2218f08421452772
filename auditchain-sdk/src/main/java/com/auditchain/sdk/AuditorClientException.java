package com.auditchain.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Non-2xx answer from the chain API, carrying the service's error code when it sent one.
 */
public class AuditorClientException extends IOException {

    private final int status;
    private final String code;

    public AuditorClientException(int status, String code, String message) {
        super("HTTP " + status + (code != null ? " " + code : "") + ": " + message);
        this.status = status;
        this.code = code;
    }

    static AuditorClientException from(int status, String body, ObjectMapper mapper) {
        try {
            JsonNode node = mapper.readTree(body);
            if (node != null && node.hasNonNull("code")) {
                return new AuditorClientException(status, node.get("code").asText(),
                        node.path("message").asText(""));
            }
        } catch (IOException e) {
            // not a JSON error body
        }
        return new AuditorClientException(status, null, body == null ? "" : body);
    }

    public int getStatus() { return status; }
    public String getCode() { return code; }
}

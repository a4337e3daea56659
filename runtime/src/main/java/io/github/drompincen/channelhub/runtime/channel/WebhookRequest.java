package io.github.drompincen.channelhub.runtime.channel;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * A platform callback as received over HTTP. Header lookup is case-insensitive; the raw body is
 * kept because some platforms sign the exact bytes.
 */
public record WebhookRequest(Map<String, String> headers, String rawBody) {

    public WebhookRequest {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) copy.putAll(headers);
        headers = copy;
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }
}

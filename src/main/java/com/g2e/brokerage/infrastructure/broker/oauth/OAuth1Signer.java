package com.g2e.brokerage.infrastructure.broker.oauth;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * HMAC-SHA1 request signing for OAuth 1.0a (RFC 5849, section 3.4).
 *
 * Query parameters of the request URI and any form parameters take part in the
 * signature base string. JSON bodies do not.
 */
public final class OAuth1Signer {

    private static final String HMAC_ALGORITHM = "HmacSHA1";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final String consumerKey;
    private final String consumerSecret;
    private final Clock clock;
    private final Supplier<String> nonceSupplier;

    public OAuth1Signer(String consumerKey, String consumerSecret, Clock clock) {
        this(consumerKey, consumerSecret, clock, OAuth1Signer::randomNonce);
    }

    public OAuth1Signer(String consumerKey, String consumerSecret, Clock clock, Supplier<String> nonceSupplier) {
        this.consumerKey = consumerKey;
        this.consumerSecret = consumerSecret;
        this.clock = clock;
        this.nonceSupplier = nonceSupplier;
    }

    public String consumerKey() {
        return consumerKey;
    }

    /**
     * Build the Authorization header value.
     *
     * @param token       oauth_token, or null for the request-token call
     * @param tokenSecret secret paired with the token, or null
     * @param extraOAuth  additional oauth_* protocol params (oauth_callback, oauth_verifier)
     * @param formParams  form body parameters, empty when the body is not form-encoded
     */
    public String authorizationHeader(String method, URI uri, String token, String tokenSecret,
                                      Map<String, String> extraOAuth, Map<String, String> formParams) {
        Map<String, String> oauth = new LinkedHashMap<>();
        oauth.put("oauth_consumer_key", consumerKey);
        oauth.put("oauth_nonce", nonceSupplier.get());
        oauth.put("oauth_signature_method", "HMAC-SHA1");
        oauth.put("oauth_timestamp", Long.toString(clock.instant().getEpochSecond()));
        if (token != null) {
            oauth.put("oauth_token", token);
        }
        oauth.put("oauth_version", "1.0");
        if (extraOAuth != null) {
            oauth.putAll(extraOAuth);
        }

        String signature = sign(method, uri, tokenSecret, oauth, formParams);
        oauth.put("oauth_signature", signature);

        return "OAuth " + oauth.entrySet().stream()
            .map(e -> percentEncode(e.getKey()) + "=\"" + percentEncode(e.getValue()) + "\"")
            .collect(Collectors.joining(", "));
    }

    String sign(String method, URI uri, String tokenSecret, Map<String, String> oauthParams,
                Map<String, String> formParams) {
        String baseString = signatureBaseString(method, uri, oauthParams, formParams);
        String key = percentEncode(consumerSecret) + "&" + percentEncode(tokenSecret == null ? "" : tokenSecret);
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            byte[] digest = mac.doFinal(baseString.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(digest);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to compute OAuth signature", e);
        }
    }

    static String signatureBaseString(String method, URI uri, Map<String, String> oauthParams,
                                      Map<String, String> formParams) {
        List<String[]> params = new ArrayList<>();
        oauthParams.forEach((k, v) -> params.add(new String[]{percentEncode(k), percentEncode(v)}));
        if (formParams != null) {
            formParams.forEach((k, v) -> params.add(new String[]{percentEncode(k), percentEncode(v)}));
        }
        String rawQuery = uri.getRawQuery();
        if (rawQuery != null && !rawQuery.isEmpty()) {
            for (String pair : rawQuery.split("&")) {
                int eq = pair.indexOf('=');
                String k = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
                String v = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
                params.add(new String[]{percentEncode(k), percentEncode(v)});
            }
        }
        params.sort((a, b) -> {
            int byKey = a[0].compareTo(b[0]);
            return byKey != 0 ? byKey : a[1].compareTo(b[1]);
        });
        String normalized = params.stream()
            .map(p -> p[0] + "=" + p[1])
            .collect(Collectors.joining("&"));

        return method.toUpperCase() + "&" + percentEncode(baseUri(uri)) + "&" + percentEncode(normalized);
    }

    static String baseUri(URI uri) {
        String scheme = uri.getScheme().toLowerCase();
        String host = uri.getHost().toLowerCase();
        int port = uri.getPort();
        boolean defaultPort = port == -1
            || ("http".equals(scheme) && port == 80)
            || ("https".equals(scheme) && port == 443);
        return scheme + "://" + host + (defaultPort ? "" : ":" + port) + uri.getRawPath();
    }

    /**
     * RFC 3986 unreserved-set encoding.
     */
    public static String percentEncode(String value) {
        if (value == null) {
            return "";
        }
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
            .replace("+", "%20")
            .replace("*", "%2A")
            .replace("%7E", "~");
    }

    private static String randomNonce() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}

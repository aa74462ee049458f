package com.edustream.studio.util;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Builds OAuth 1.0a {@code Authorization} headers signed with HMAC-SHA1 for user-context calls.
 * Only query and form parameters take part in the signature; JSON and multipart bodies do not.
 */
public class OAuth1Signer {

    private static final String SIGNATURE_METHOD = "HMAC-SHA1";
    private static final String HMAC_ALGORITHM = "HmacSHA1";

    private final String consumerKey;
    private final String consumerSecret;
    private final String accessToken;
    private final String accessTokenSecret;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public OAuth1Signer(String consumerKey, String consumerSecret,
                        String accessToken, String accessTokenSecret, Clock clock) {
        this.consumerKey = consumerKey;
        this.consumerSecret = consumerSecret;
        this.accessToken = accessToken;
        this.accessTokenSecret = accessTokenSecret;
        this.clock = clock;
    }

    public String authorizationHeader(String method, String url, Map<String, String> requestParams) {
        byte[] nonceBytes = new byte[16];
        random.nextBytes(nonceBytes);
        return authorizationHeader(method, url, requestParams, HexFormat.of().formatHex(nonceBytes), clock.millis() / 1000);
    }

    public String authorizationHeader(String method, String url, Map<String, String> requestParams,
                                      String nonce, long timestampSeconds) {
        Map<String, String> oauthParams = new TreeMap<>();
        oauthParams.put("oauth_consumer_key", consumerKey);
        oauthParams.put("oauth_nonce", nonce);
        oauthParams.put("oauth_signature_method", SIGNATURE_METHOD);
        oauthParams.put("oauth_timestamp", String.valueOf(timestampSeconds));
        oauthParams.put("oauth_token", accessToken);
        oauthParams.put("oauth_version", "1.0");

        oauthParams.put("oauth_signature", sign(method, url, requestParams, oauthParams));

        return "OAuth " + oauthParams.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=\"" + encode(e.getValue()) + "\"")
                .collect(Collectors.joining(", "));
    }

    String sign(String method, String url, Map<String, String> requestParams, Map<String, String> oauthParams) {
        // Sorted on the encoded keys, which for these names matches the raw order
        Map<String, String> all = new TreeMap<>();
        requestParams.forEach((k, v) -> all.put(encode(k), encode(v)));
        oauthParams.forEach((k, v) -> all.put(encode(k), encode(v)));
        String paramString = all.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));

        String baseString = method.toUpperCase() + "&" + encode(url) + "&" + encode(paramString);
        String signingKey = encode(consumerSecret) + "&" + encode(accessTokenSecret);
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(signingKey.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return Base64.getEncoder().encodeToString(mac.doFinal(baseString.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA1 is not available", e);
        }
    }

    /** RFC 3986 percent-encoding. */
    public static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }
}

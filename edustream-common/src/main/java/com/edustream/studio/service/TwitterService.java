package com.edustream.studio.service;

import com.edustream.studio.dto.PublishResult;
import com.edustream.studio.model.Platform;
import com.edustream.studio.util.OAuth1Signer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Posts image tweets: media upload through the v1.1 endpoint, then tweet creation through v2,
 * both signed with the account's OAuth 1.0a user credentials.
 */
@Service
@Slf4j
public class TwitterService implements SocialPublisher {

    static final String MEDIA_UPLOAD_URL = "https://upload.twitter.com/1.1/media/upload.json";
    static final String CREATE_TWEET_URL = "https://api.twitter.com/2/tweets";
    static final int MAX_TWEET_LENGTH = 280;

    private final RestTemplate restTemplate;
    private final FileStorageService storageService;
    private final OAuth1Signer signer;
    private final boolean configured;

    public TwitterService(RestTemplate restTemplate,
                          FileStorageService storageService,
                          Clock clock,
                          @Value("${app.twitter.api-key:}") String apiKey,
                          @Value("${app.twitter.api-secret:}") String apiSecret,
                          @Value("${app.twitter.access-token:}") String accessToken,
                          @Value("${app.twitter.access-token-secret:}") String accessTokenSecret) {
        this.restTemplate = restTemplate;
        this.storageService = storageService;
        this.configured = !apiKey.isBlank() && !apiSecret.isBlank()
                && !accessToken.isBlank() && !accessTokenSecret.isBlank();
        this.signer = configured ? new OAuth1Signer(apiKey, apiSecret, accessToken, accessTokenSecret, clock) : null;
    }

    @Override
    public Platform platform() {
        return Platform.TWITTER;
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public PublishResult postImage(String imagePath, String caption, List<String> hashtags) {
        if (!configured) {
            throw new IllegalStateException("Twitter API credentials not configured. Set app.twitter.api-key, "
                    + "app.twitter.api-secret, app.twitter.access-token and app.twitter.access-token-secret");
        }

        byte[] image = loadImage(imagePath);
        String text = buildTweetText(caption, hashtags);

        String mediaId = uploadMedia(image, Paths.get(imagePath).getFileName().toString());
        String tweetId = createTweet(text, mediaId);
        log.info("Tweet {} created with media {}", tweetId, mediaId);

        return new PublishResult(tweetId, "https://twitter.com/i/status/" + tweetId, text);
    }

    /**
     * Appends hashtags after a blank line and keeps the whole text within 280 characters by
     * shortening the caption, never the hashtags.
     */
    static String buildTweetText(String caption, List<String> hashtags) {
        String suffix = "";
        if (hashtags != null && !hashtags.isEmpty()) {
            suffix = "\n\n" + hashtags.stream()
                    .map(String::trim)
                    .filter(tag -> !tag.isEmpty())
                    .map(tag -> "#" + tag.replaceFirst("^#+", ""))
                    .collect(Collectors.joining(" "));
        }
        String text = caption + suffix;
        if (text.length() <= MAX_TWEET_LENGTH) {
            return text;
        }
        int maxCaption = Math.max(0, MAX_TWEET_LENGTH - suffix.length() - 3);
        return caption.substring(0, Math.min(caption.length(), maxCaption)) + "..." + suffix;
    }

    private byte[] loadImage(String imagePath) {
        Path local = Paths.get(imagePath);
        try {
            if (Files.isRegularFile(local)) {
                return Files.readAllBytes(local);
            }
            try (InputStream in = storageService.downloadFile(imagePath)) {
                return in.readAllBytes();
            }
        } catch (IOException e) {
            throw new RuntimeException("Image not found: " + imagePath, e);
        }
    }

    @SuppressWarnings("rawtypes")
    private String uploadMedia(byte[] image, String filename) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        headers.set(HttpHeaders.AUTHORIZATION, signer.authorizationHeader("POST", MEDIA_UPLOAD_URL, Map.of()));

        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("media", new ByteArrayResource(image) {
            @Override
            public String getFilename() {
                return filename;
            }
        });

        Map response = restTemplate.postForObject(MEDIA_UPLOAD_URL, new HttpEntity<>(body, headers), Map.class);
        if (response == null || response.get("media_id_string") == null) {
            throw new RuntimeException("Twitter media upload returned no media id");
        }
        return (String) response.get("media_id_string");
    }

    @SuppressWarnings("rawtypes")
    private String createTweet(String text, String mediaId) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.AUTHORIZATION, signer.authorizationHeader("POST", CREATE_TWEET_URL, Map.of()));

        Map<String, Object> body = Map.of(
                "text", text,
                "media", Map.of("media_ids", List.of(mediaId)));

        Map response = restTemplate.postForObject(CREATE_TWEET_URL, new HttpEntity<>(body, headers), Map.class);
        if (response == null || !(response.get("data") instanceof Map data) || data.get("id") == null) {
            throw new RuntimeException("Twitter did not return a tweet id");
        }
        return String.valueOf(data.get("id"));
    }
}

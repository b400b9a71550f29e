package io.riskradar.ingestion.api.service.extraction;

import io.riskradar.ingestion.api.dto.ContentItem;
import io.riskradar.ingestion.api.service.fetch.FetchClient;
import io.riskradar.ingestion.config.SourceDescriptor;
import io.riskradar.ingestion.config.SourceType;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.riskradar.ingestion.api.service.extraction.ExtractionSupport.*;

/**
 * Social platforms and discussion boards. The platform is picked from the source URL:
 * Reddit listings, Twitter/X timelines, or a generic forum layout for anything else.
 */
public class SocialExtractionStrategy implements ExtractionStrategy {

    private static final Logger logger = LoggerFactory.getLogger(SocialExtractionStrategy.class);

    enum Platform {
        REDDIT,
        TWITTER,
        FORUM
    }

    static final ListingProfile REDDIT_PROFILE = new ListingProfile(
            "[data-testid=\"post-container\"]", "h3", "[data-testid=\"post-content\"]", "a[href*=\"/comments/\"]",
            5, 10,
            1, 0, 500,
            List.of(), 0, 0, 0);

    static final ListingProfile FORUM_PROFILE = new ListingProfile(
            ".post, .topic, .thread", "h2, h3, .title", ".content, .message, p", "a",
            5, 15,
            2, 10, 400,
            List.of(), 0, 0, 0);

    private static final String TWEET_SELECTOR = "[data-testid=\"tweet\"]";
    private static final String TWEET_TEXT_SELECTOR = "[data-testid=\"tweetText\"]";
    private static final int MAX_TWEETS = 5;
    private static final int MIN_TWEET_LENGTH = 10;
    private static final int TWEET_TITLE_LENGTH = 100;

    private static final List<String> UPVOTE_SELECTORS =
            List.of("[data-testid=\"upvote-button\"]", ".upvotes", ".score");
    private static final List<String> COMMENT_SELECTORS =
            List.of("[data-testid=\"comment-button\"]", ".comments", ".comment-count");
    private static final Pattern SUBREDDIT = Pattern.compile("/r/([^/]+)");

    private final ListingExtractor redditExtractor = new ListingExtractor(REDDIT_PROFILE, this::describeRedditPost);
    private final ListingExtractor forumExtractor = new ListingExtractor(FORUM_PROFILE, this::describeForumPost);

    @Override
    public SourceType type() {
        return SourceType.SOCIAL;
    }

    @Override
    public List<ContentItem> extract(Document document, SourceDescriptor source, FetchClient client) {
        return switch (platformOf(source.url())) {
            case REDDIT -> redditExtractor.extract(document, source, client);
            case TWITTER -> extractTweets(document, source);
            case FORUM -> forumExtractor.extract(document, source, client);
        };
    }

    static Platform platformOf(String url) {
        String lowerUrl = url != null ? url.toLowerCase(Locale.ROOT) : "";
        if (lowerUrl.contains("reddit.com")) return Platform.REDDIT;
        if (lowerUrl.contains("twitter.com") || lowerUrl.contains("x.com")) return Platform.TWITTER;
        return Platform.FORUM;
    }

    /**
     * Tweets have no per-item link in the timeline markup, so every item points at the source
     * URL and the seen-URL set is not consulted.
     */
    private List<ContentItem> extractTweets(Document document, SourceDescriptor source) {
        Elements tweets = document.select(TWEET_SELECTOR);
        logger.info("Found {} tweet elements for {}", tweets.size(), source.name());

        List<ContentItem> items = new ArrayList<>();
        for (Element tweet : tweets.subList(0, Math.min(tweets.size(), MAX_TWEETS))) {
            String text = text(tweet.selectFirst(TWEET_TEXT_SELECTOR));
            if (text.length() < MIN_TWEET_LENGTH || !matchesKeywords(source.keywords(), text)) {
                continue;
            }

            String title = text.length() > TWEET_TITLE_LENGTH
                    ? text.substring(0, TWEET_TITLE_LENGTH) + "..."
                    : text;

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("article_type", "tweet");
            metadata.put("platform", "twitter");
            metadata.put("character_count", text.length());

            items.add(contentItem(source, title, text, source.url(), metadata));
        }
        return items;
    }

    private Map<String, Object> describeRedditPost(Element container, String title, String description, String url) {
        int upvotes = firstNumber(container, UPVOTE_SELECTORS);
        int comments = firstNumber(container, COMMENT_SELECTORS);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("article_type", "reddit_post");
        metadata.put("platform", "reddit");
        metadata.put("subreddit", subreddit(url));
        metadata.put("upvotes", upvotes);
        metadata.put("comments_count", comments);
        metadata.put("engagement_score", upvotes + comments * 2);
        return metadata;
    }

    private Map<String, Object> describeForumPost(Element container, String title, String description, String url) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("article_type", "forum_post");
        metadata.put("platform", "forum");
        return metadata;
    }

    static String subreddit(String url) {
        Matcher matcher = SUBREDDIT.matcher(url);
        return matcher.find() ? matcher.group(1) : "";
    }
}

package io.riskradar.ingestion.api.service.extraction;

import io.riskradar.ingestion.api.dto.ContentItem;
import io.riskradar.ingestion.api.service.fetch.FetchClient;
import io.riskradar.ingestion.config.SourceDescriptor;
import io.riskradar.ingestion.config.SourceType;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class SocialExtractionStrategyTest {

    @Mock
    private FetchClient client;

    private final SocialExtractionStrategy strategy = new SocialExtractionStrategy();

    @Test
    @DisplayName("Should extract Reddit posts with engagement metadata")
    void shouldExtractRedditPosts() {
        String sourceUrl = "https://www.reddit.com/r/netsec/";
        String html = """
                <div data-testid="post-container">
                  <h3>New exploit chain for Chrome released</h3>
                  <a href="/r/netsec/comments/abc123/new_exploit_chain/">comments</a>
                  <div data-testid="post-content">Proof of concept targets the V8 engine.</div>
                  <span class="score">120 points</span>
                  <span class="comments">14 comments</span>
                </div>
                """;

        List<ContentItem> items = strategy.extract(Jsoup.parse(html, sourceUrl),
                SourceDescriptor.of("r/netsec", SourceType.SOCIAL, sourceUrl, Set.of("exploit")), client);

        assertThat(items).singleElement().satisfies(post -> {
            assertThat(post.url()).isEqualTo("https://www.reddit.com/r/netsec/comments/abc123/new_exploit_chain/");
            assertThat(post.body()).isEqualTo("Proof of concept targets the V8 engine.");
            assertThat(post.metadata())
                    .containsEntry("platform", "reddit")
                    .containsEntry("subreddit", "netsec")
                    .containsEntry("upvotes", 120)
                    .containsEntry("comments_count", 14)
                    .containsEntry("engagement_score", 148);
        });
    }

    @Test
    @DisplayName("Should keep a Reddit post whose counters overflow and report them as zero")
    void shouldKeepPostWithOversizedCounters() {
        String sourceUrl = "https://www.reddit.com/r/netsec/";
        String html = """
                <div data-testid="post-container">
                  <h3>Exploit kit resurfaces on underground market</h3>
                  <a href="/r/netsec/comments/def456/exploit_kit/">comments</a>
                  <div data-testid="post-content">Sellers advertise updated browser payloads.</div>
                  <span class="score">98765432101 points</span>
                  <span class="comments">3 comments</span>
                </div>
                """;

        List<ContentItem> items = strategy.extract(Jsoup.parse(html, sourceUrl),
                SourceDescriptor.of("r/netsec", SourceType.SOCIAL, sourceUrl, Set.of("exploit")), client);

        assertThat(items).singleElement().satisfies(post -> assertThat(post.metadata())
                .containsEntry("upvotes", 0)
                .containsEntry("comments_count", 3)
                .containsEntry("engagement_score", 6));
    }

    @Test
    @DisplayName("Should turn tweets into items pointing at the timeline")
    void shouldExtractTweets() {
        String sourceUrl = "https://twitter.com/search?q=breach";
        String longTweet = "Breaking: a large breach at a payment processor exposed millions of card records, "
                + "investigators say the intrusion started weeks ago";
        String html = """
                <div data-testid="tweet"><div data-testid="tweetText">ok breach</div></div>
                <div data-testid="tweet"><div data-testid="tweetText">%s</div></div>
                <div data-testid="tweet"><div data-testid="tweetText">Lovely weather in the city today</div></div>
                """.formatted(longTweet);

        List<ContentItem> items = strategy.extract(Jsoup.parse(html, sourceUrl),
                SourceDescriptor.of("Twitter breach search", SourceType.SOCIAL, sourceUrl, Set.of("breach")), client);

        assertThat(items).singleElement().satisfies(tweet -> {
            assertThat(tweet.title()).hasSize(103).endsWith("...");
            assertThat(tweet.body()).isEqualTo(longTweet);
            assertThat(tweet.url()).isEqualTo(sourceUrl);
            assertThat(tweet.metadata())
                    .containsEntry("article_type", "tweet")
                    .containsEntry("character_count", longTweet.length());
        });
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("Should fall back to forum layout for other hosts")
    void shouldExtractForumPosts() {
        String sourceUrl = "https://forum.example.org/security";
        String html = """
                <div class="thread">
                  <h2><a href="/t/ddos-wave">DDoS wave against regional ISPs</a></h2>
                  <div class="message">Several providers report sustained floods since Monday.</div>
                </div>
                """;

        List<ContentItem> items = strategy.extract(Jsoup.parse(html, sourceUrl),
                SourceDescriptor.of("Security forum", SourceType.SOCIAL, sourceUrl, Set.of()), client);

        assertThat(items).singleElement().satisfies(post -> {
            assertThat(post.url()).isEqualTo("https://forum.example.org/t/ddos-wave");
            assertThat(post.metadata()).containsEntry("platform", "forum");
        });
    }

    @Test
    @DisplayName("Should detect the platform from the source URL")
    void shouldDetectPlatform() {
        assertThat(SocialExtractionStrategy.platformOf("https://old.reddit.com/r/cybersecurity"))
                .isEqualTo(SocialExtractionStrategy.Platform.REDDIT);
        assertThat(SocialExtractionStrategy.platformOf("https://x.com/cisagov"))
                .isEqualTo(SocialExtractionStrategy.Platform.TWITTER);
        assertThat(SocialExtractionStrategy.platformOf(null))
                .isEqualTo(SocialExtractionStrategy.Platform.FORUM);
        assertThat(SocialExtractionStrategy.subreddit("https://www.reddit.com/r/netsec/comments/1")).isEqualTo("netsec");
    }
}

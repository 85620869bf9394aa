package com.flamingo.ai.chatsearch.config;

import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for query building, result caching and the vectorizer. */
@Configuration
@ConfigurationProperties(prefix = "search")
@Getter
@Setter
public class SearchConfig {

  private Cache cache = new Cache();
  private Limits limits = new Limits();
  private Indices indices = new Indices();
  private Vectorizer vectorizer = new Vectorizer();
  private Async async = new Async();

  @Getter
  @Setter
  public static class Cache {
    private boolean enabled = true;
    private long ttlSeconds = 300;

    /** Namespace for all keys written by the result cache. */
    private String keyPrefix = "search:";

    /** Cache store backing the result cache: "redis" (default) or "memory". */
    private String store = "redis";
  }

  @Getter
  @Setter
  public static class Limits {
    private int lexicalDefault = 50;
    private int semanticDefault = 20;

    /** Upper bound on any caller-supplied limit. */
    private int maxSize = 500;
  }

  @Getter
  @Setter
  public static class Indices {
    private String messages = "chat-messages";
    private String users = "chat-users";
    private String rooms = "chat-rooms";

    public String nameFor(SearchDomain domain) {
      return switch (domain) {
        case MESSAGES -> messages;
        case USERS -> users;
        case ROOMS -> rooms;
      };
    }
  }

  @Getter
  @Setter
  public static class Vectorizer {
    /** Vectorizer provider: "tfidf" (default, fit once at startup) or "openai". */
    private String provider = "tfidf";

    /** Corpus the TF-IDF vocabulary is fit on, one document per line. */
    private String corpusLocation = "classpath:vectorizer/corpus.txt";

    /** Maximum vocabulary size for the TF-IDF vectorizer. */
    private int maxFeatures = 4096;

    /** Vector dimensions for the OpenAI provider. */
    private int dimensions = 1536;
  }

  @Getter
  @Setter
  public static class Async {
    private int corePoolSize = 4;
    private int maxPoolSize = 16;
    private int queueCapacity = 200;
    private Duration timeout = Duration.ofSeconds(10);
  }
}

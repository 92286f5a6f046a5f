package com.flamingo.ai.constitution.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the constitution content, cache, search and analytics. */
@Configuration
@ConfigurationProperties(prefix = "constitution")
@Validated
@Getter
@Setter
public class ConstitutionProperties {

  @Valid private Source source = new Source();
  @Valid private Cache cache = new Cache();
  @Valid private Search search = new Search();
  @Valid private Analytics analytics = new Analytics();
  @Valid private Reading reading = new Reading();

  @Getter
  @Setter
  public static class Source {
    /** Spring resource location of the constitution JSON (classpath: or file:). */
    @NotBlank private String location = "classpath:data/constitution.json";
  }

  @Getter
  @Setter
  public static class Cache {
    /** Namespace prepended to every cache key. */
    @NotBlank private String prefix = "constitution";

    /** Key-value backend: memory or redis. */
    @Pattern(regexp = "memory|redis")
    private String backend = "memory";

    @Min(1)
    private long maximumSize = 10_000;
    private Ttl ttl = new Ttl();
    private Redis redis = new Redis();
  }

  @Getter
  @Setter
  public static class Ttl {
    private Duration document = Duration.ofHours(6);
    private Duration overview = Duration.ofHours(6);
    private Duration chapter = Duration.ofHours(24);
    private Duration article = Duration.ofHours(24);
    private Duration search = Duration.ofHours(1);
    private Duration popular = Duration.ofHours(1);
  }

  @Getter
  @Setter
  public static class Redis {
    private String host = "localhost";
    private int port = 6379;
    private String password;
    private int database = 0;
    private int timeoutMillis = 2000;
  }

  @Getter
  @Setter
  public static class Search {
    @Min(1)
    private int maxLimit = 1000;

    @Min(1)
    private int maxQueryLength = 500;

    @Min(0)
    private int maxOffset = 100_000;

    /** Characters kept on each side of the first preamble match. */
    private int contextWindow = 50;

    /** Queries are truncated to this length before being recorded as views. */
    private int trackedQueryLength = 50;
  }

  @Getter
  @Setter
  public static class Analytics {
    private int maxPopularLimit = 100;
    private Duration bucketRetention = Duration.ofDays(2);
  }

  @Getter
  @Setter
  public static class Reading {
    @Min(1)
    private int wordsPerMinute = 200;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double completionRatio = 0.3;

    private double minimumMinutes = 2.0;
  }
}

package com.flamingo.ai.chatsearch;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chatsearch.service.search.SearchBackend;
import com.flamingo.ai.chatsearch.service.search.SearchOrchestrator;
import com.flamingo.ai.chatsearch.service.search.cache.CacheStore;
import com.flamingo.ai.chatsearch.service.search.cache.InMemoryCacheStore;
import com.flamingo.ai.chatsearch.service.vectorizer.VectorizerService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Integration test that verifies the Spring application context loads correctly. The search
 * backend is mocked and the in-memory cache store is selected so the test runs without
 * Elasticsearch or Redis.
 */
@SpringBootTest(properties = {"search.cache.store=memory", "search.vectorizer.provider=tfidf"})
class ApplicationContextTest {

  @MockitoBean private SearchBackend searchBackend;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Core search beans should be available")
  void coreBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(SearchOrchestrator.class)).isNotNull();
    assertThat(applicationContext.getBean(CacheStore.class))
        .isInstanceOf(InMemoryCacheStore.class);
    assertThat(applicationContext.getBean(VectorizerService.class).dimensions()).isPositive();
  }
}

/*
 * どこで: Rating 設定
 * 何を: Clock と RatingEngine を Bean として提供する
 * なぜ: 時刻をテストで差し替え可能にし、プール全体で 1 つのエンジンを共有するため
 */
package com.example.rating.config;

import com.example.glicko.engine.RatingEngine;
import com.example.glicko.model.GlickoSettings;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RatingEngineConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public GlickoSettings glickoSettings(RatingProperties properties) {
    return properties.toSettings();
  }

  @Bean
  public RatingEngine ratingEngine(GlickoSettings settings, Clock clock) {
    return new RatingEngine(settings, clock);
  }
}

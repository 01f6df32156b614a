/*
 * どこで: Rating アプリのスモークテスト
 * 何を: Spring コンテキストの起動と主要 Bean の配線を確認する
 * なぜ: application.yml の既定値で構成が破壊されていないことを担保するため
 */
package com.example.rating;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.glicko.engine.RatingEngine;
import com.example.rating.service.RatingService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class RatingApplicationTests {

  @Autowired private RatingEngine engine;
  @Autowired private RatingService service;

  @Test
  void contextLoadsWithDefaultSettings() {
    assertThat(engine.settings().tau()).isEqualTo(0.75);
    assertThat(service.currentRating(service.register(null)).rating()).isEqualTo(1500.0);
  }
}

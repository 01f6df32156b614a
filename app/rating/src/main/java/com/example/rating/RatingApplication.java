/*
 * どこで: Rating アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: Glicko エンジンを外部化した設定とメトリクス付きで単一アプリとして起動するため
 */
package com.example.rating;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RatingApplication {

  public static void main(String[] args) {
    SpringApplication.run(RatingApplication.class, args);
  }
}

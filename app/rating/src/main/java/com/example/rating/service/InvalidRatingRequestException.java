/*
 * どこで: Rating サービス層
 * 何を: 呼び出し側入力の妥当性エラーを表現する
 * なぜ: エンジンへ渡す前に不正な結果文字列や重複ハンドルを弾くため
 */
package com.example.rating.service;

public class InvalidRatingRequestException extends RuntimeException {
  public InvalidRatingRequestException(String message) {
    super(message);
  }
}

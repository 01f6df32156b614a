/*
 * どこで: Glicko レーティングエンジン
 * 何を: 未登録ハンドルの参照を表現する
 * なぜ: 呼び出し側の誤用を黙殺せず必ず通知するため
 */
package com.example.glicko.engine;

import com.example.glicko.model.PlayerHandle;

public class UnknownPlayerException extends RuntimeException {

  private final PlayerHandle handle;

  public UnknownPlayerException(PlayerHandle handle) {
    super("player not found: " + handle);
    this.handle = handle;
  }

  public PlayerHandle handle() {
    return handle;
  }
}

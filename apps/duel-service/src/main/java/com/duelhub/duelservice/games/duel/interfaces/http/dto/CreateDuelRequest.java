package com.duelhub.duelservice.games.duel.interfaces.http.dto;

import lombok.Data;

/**
 * 发起对决请求体，调用方即为 A 方。
 */
@Data
public class CreateDuelRequest {
    private String opponentId;
}

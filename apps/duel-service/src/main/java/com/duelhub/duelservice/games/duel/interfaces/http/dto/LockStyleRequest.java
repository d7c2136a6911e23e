package com.duelhub.duelservice.games.duel.interfaces.http.dto;

import lombok.Data;

@Data
public class LockStyleRequest {
    private String styleId;
}

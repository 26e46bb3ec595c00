package com.wordhub.gameservice.games.words.interfaces.http.dto;

import lombok.Data;

@Data
public class JoinRequest {
    private String name;
    private boolean robot;
    /** 仅对机器人有意义 */
    private boolean canChallenge;
}

package com.wordhub.gameservice.games.words.interfaces.http.dto;

import com.wordhub.gameservice.games.words.domain.model.Tile;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class SwapRequest {
    private List<Tile> tiles = new ArrayList<>();
}

package com.example.spellgrid.model;

/**
 * Overall game status. VICTORY and GAME_OVER are absorbing until restart.
 */
public enum GameStatus {
    PLAYING,
    VICTORY,
    GAME_OVER
}

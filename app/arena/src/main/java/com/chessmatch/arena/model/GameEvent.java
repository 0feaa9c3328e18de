package com.chessmatch.arena.model;

public enum GameEvent {
  MOVE_PLAYED,
  WHITE_WON,
  BLACK_WON,
  DRAWN
}

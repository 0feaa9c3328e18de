package com.chessmatch.arena.model;

public enum GameType {
  CHESS
}

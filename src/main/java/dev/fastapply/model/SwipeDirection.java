package dev.fastapply.model;

public enum SwipeDirection {
    LEFT,
    RIGHT
}

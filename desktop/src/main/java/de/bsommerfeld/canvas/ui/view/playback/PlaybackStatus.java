package de.bsommerfeld.canvas.ui.view.playback;

public enum PlaybackStatus {
    IDLE,
    PLAYING,
    PAUSED,
    STOPPED,
    FINISHED,
    ERROR
}

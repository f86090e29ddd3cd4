package com.kopo.livequiz.service;

public enum ViewerRole {
    HOST,
    PLAYER
}

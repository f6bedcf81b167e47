package org.gc.freegames.domain;

public enum ContentType {
    TEXT,
    IMAGE
}

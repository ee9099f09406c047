package io.amqpmesh.logging;

public enum LogLevel {
    INFO,
    WARN,
    ERROR
}

package com.herzen.planner.path;

@FunctionalInterface
public interface PathIdGenerator {
    String nextId();
}

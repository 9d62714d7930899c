package com.vidfeed.service;

@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}

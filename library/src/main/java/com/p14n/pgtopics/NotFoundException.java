package com.p14n.pgtopics;

public class NotFoundException extends PubSubException {

    public NotFoundException(String message) {
        super(message);
    }
}

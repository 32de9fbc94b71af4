package com.purchasingpower.graphrag.exception;

public class BuildInProgressException extends GraphRagException {

    public BuildInProgressException() {
        super("A graph build is already in progress");
    }
}

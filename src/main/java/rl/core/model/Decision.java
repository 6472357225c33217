package rl.core.model;

public enum Decision {
    ALLOW,
    REJECT
}

package io.judgebridge.session;

@FunctionalInterface
public interface JudgeAuthenticator {
    boolean authenticate(String judgeId, String key);
}

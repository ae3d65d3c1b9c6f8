package com.boardwatch.watch.secret;

public interface SecretProvider {

    /**
     * @throws SecretAccessException when the secret is missing, empty or unreadable
     */
    String getSecret(String name);

    default boolean isAccessible(String name) {
        try {
            getSecret(name);
            return true;
        } catch (SecretAccessException e) {
            return false;
        }
    }
}

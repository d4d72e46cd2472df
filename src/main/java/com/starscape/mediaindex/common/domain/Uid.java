package com.starscape.mediaindex.common.domain;

import java.security.SecureRandom;
import java.time.Instant;

/**
 * Type-prefixed unique identifiers, e.g. {@code p0x9kq2ab3cd4ef5}.
 * <p>
 * Layout: one prefix character, six base-36 characters of creation time in
 * epoch seconds, nine random base-36 characters. Always 16 characters, lower case.
 */
public final class Uid {
    
    public static final int LENGTH = 16;
    
    public static final char PHOTO = 'p';
    public static final char FILE = 'f';
    public static final char ALBUM = 'a';
    public static final char LABEL = 'l';
    public static final char USER = 'u';
    
    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int TIME_CHARS = 6;
    private static final int RANDOM_CHARS = LENGTH - 1 - TIME_CHARS;
    private static final SecureRandom RANDOM = new SecureRandom();
    
    private Uid() {
    }
    
    public static String generate(char prefix) {
        StringBuilder sb = new StringBuilder(LENGTH);
        sb.append(prefix);
        
        String time = Long.toString(Instant.now().getEpochSecond(), 36);
        if (time.length() > TIME_CHARS) {
            time = time.substring(time.length() - TIME_CHARS);
        }
        for (int i = time.length(); i < TIME_CHARS; i++) {
            sb.append('0');
        }
        sb.append(time);
        
        for (int i = 0; i < RANDOM_CHARS; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
    
    /**
     * Returns true if the value is a well-formed UID carrying the given type prefix.
     */
    public static boolean isValid(String uid, char prefix) {
        if (uid == null || uid.length() != LENGTH || uid.charAt(0) != prefix) {
            return false;
        }
        for (int i = 1; i < LENGTH; i++) {
            if (ALPHABET.indexOf(uid.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }
    
    /**
     * Keeps an existing valid UID, otherwise generates a new one.
     */
    public static String ensure(String current, char prefix) {
        return isValid(current, prefix) ? current : generate(prefix);
    }
}

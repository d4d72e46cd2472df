package com.starscape.mediaindex.features.primaryfile.app;

import com.starscape.mediaindex.common.exception.NotFoundException;

/**
 * No file of the photo qualifies as primary. Nothing was changed.
 */
public class NoEligibleFileException extends NotFoundException {
    
    public NoEligibleFileException(String message) {
        super(message);
    }
}

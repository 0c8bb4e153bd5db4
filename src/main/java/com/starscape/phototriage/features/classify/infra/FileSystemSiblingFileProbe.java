package com.starscape.phototriage.features.classify.infra;

import com.starscape.phototriage.features.classify.app.SiblingFileProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Checks sibling files on the local filesystem the source paths were recorded from.
 */
@Component
public class FileSystemSiblingFileProbe implements SiblingFileProbe {
    
    private static final Logger log = LoggerFactory.getLogger(FileSystemSiblingFileProbe.class);
    
    @Override
    public boolean exists(String path) {
        try {
            return Files.exists(Path.of(path));
        } catch (InvalidPathException e) {
            log.debug("Treating unparseable path as missing: {}", path);
            return false;
        }
    }
}

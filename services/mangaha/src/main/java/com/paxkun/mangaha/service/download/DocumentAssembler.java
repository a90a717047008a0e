package com.paxkun.mangaha.service.download;

import java.nio.file.Path;
import java.util.List;

/**
 * Combines local image files into a single document.
 */
public interface DocumentAssembler {

    /**
     * Writes one document containing {@code images} in the given order.
     *
     * @param images ordered, readable image files
     * @param output file to create or replace
     * @throws AssemblyException if an image cannot be read or the output cannot be written
     */
    void assemble(List<Path> images, Path output);
}

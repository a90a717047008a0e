package com.paxkun.mangaha.service.download;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * PDF assembler backed by PDFBox: one page per image, each page exactly the size of its image.
 */
@Slf4j
public class PdfDocumentAssembler implements DocumentAssembler {

    @Override
    public void assemble(List<Path> images, Path output) {
        if (images == null || images.isEmpty()) {
            throw new AssemblyException("No images to assemble into " + output);
        }

        try (PDDocument document = new PDDocument()) {
            for (Path image : images) {
                PDImageXObject pdImage = loadImage(document, image);
                PDRectangle box = new PDRectangle(pdImage.getWidth(), pdImage.getHeight());
                PDPage page = new PDPage(box);
                document.addPage(page);

                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.drawImage(pdImage, 0, 0, box.getWidth(), box.getHeight());
                }
            }
            document.save(output.toFile());
            log.info("📕 Wrote {} page(s) to {}", images.size(), output);
        } catch (IOException e) {
            throw new AssemblyException("Failed to write PDF " + output + ": " + e.getMessage(), e);
        }
    }

    private PDImageXObject loadImage(PDDocument document, Path image) {
        if (!Files.isRegularFile(image) || !Files.isReadable(image)) {
            throw new AssemblyException("Image is not readable: " + image);
        }
        try {
            return PDImageXObject.createFromFileByContent(image.toFile(), document);
        } catch (IOException | IllegalArgumentException e) {
            throw new AssemblyException("Unsupported or corrupt image " + image + ": " + e.getMessage(), e);
        }
    }
}

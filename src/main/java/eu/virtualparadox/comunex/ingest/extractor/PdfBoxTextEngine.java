package eu.virtualparadox.comunex.ingest.extractor;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;

/**
 * Primary engine: Apache PDFBox, one stripper pass per page.
 */
@Component
public class PdfBoxTextEngine implements PdfTextEngine {

    public static final String NAME = "pdfbox";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PageTexts extractPages(final Path pdf, final int maxPages) throws IOException {
        try (PDDocument document = PDDocument.load(pdf.toFile())) {
            final int pageCount = document.getNumberOfPages();
            final int last = maxPages > 0 ? Math.min(maxPages, pageCount) : pageCount;
            final PDFTextStripper stripper = new PDFTextStripper();

            final List<String> pages = new ArrayList<>(last);
            for (int page = 1; page <= last; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                pages.add(Normalizer.normalize(stripper.getText(document), Normalizer.Form.NFC));
            }
            return new PageTexts(pages, pageCount);
        }
    }
}

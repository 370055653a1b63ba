package eu.virtualparadox.comunex.ingest.extractor;

import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.PagedText;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.pdf.PDFParser;
import org.apache.tika.sax.ToXMLContentHandler;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;

/**
 * Fallback engine: Apache Tika's PDF parser. Page boundaries are recovered from the
 * {@code <div class="page">} elements of the XHTML it emits.
 */
@Component
public class TikaTextEngine implements PdfTextEngine {

    public static final String NAME = "tika";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PageTexts extractPages(final Path pdf, final int maxPages) throws IOException {
        final ToXMLContentHandler handler = new ToXMLContentHandler();
        final Metadata metadata = new Metadata();
        try (InputStream in = Files.newInputStream(pdf)) {
            new PDFParser().parse(in, handler, metadata, new ParseContext());
        } catch (SAXException | TikaException e) {
            throw new IOException("Tika could not parse " + pdf.getFileName(), e);
        }

        final List<String> pages = new ArrayList<>();
        for (final Element page : Jsoup.parse(handler.toString()).select("div.page")) {
            if (maxPages > 0 && pages.size() >= maxPages) {
                break;
            }
            pages.add(Normalizer.normalize(page.wholeText(), Normalizer.Form.NFC));
        }

        final Integer declared = metadata.getInt(PagedText.N_PAGES);
        final int pageCount = Math.max(declared != null ? declared : 0, pages.size());
        return new PageTexts(pages, pageCount);
    }
}

package ai.storygen.chapters.reader;

import ai.storygen.chapters.nav.NavigationEntry;
import ai.storygen.chapters.util.TextNormalizer;
import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import net.lingala.zip4j.ZipFile;
import net.lingala.zip4j.model.FileHeader;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

/**
 * Read access to the parts of an EPUB container needed for chapter extraction: the package document, the
 * navigation manifest and the content documents.
 */
final class EpubArchive implements Closeable {

    static final String EPUB_MIMETYPE = "application/epub+zip";
    static final String MIMETYPE_ENTRY = "mimetype";
    static final String CONTAINER_ENTRY = "META-INF/container.xml";
    static final String NCX_MEDIA_TYPE = "application/x-dtbncx+xml";

    private final Path path;
    private final ZipFile zipFile;
    private final String packageEntry;
    private final Document packageDocument;

    private EpubArchive(Path path, ZipFile zipFile, String packageEntry, Document packageDocument) {
        this.path = path;
        this.zipFile = zipFile;
        this.packageEntry = packageEntry;
        this.packageDocument = packageDocument;
    }

    static EpubArchive open(Path path) throws IOException {
        ZipFile zipFile = new ZipFile(path.toFile());
        try {
            Document container = parseXml(readEntry(zipFile, CONTAINER_ENTRY), CONTAINER_ENTRY);
            Element rootFile = container.selectFirst("rootfile[full-path]");
            if (rootFile == null) {
                throw new IOException("EPUB container declares no package document: " + path);
            }
            String packageEntry = decode(rootFile.attr("full-path"));
            Document packageDocument = parseXml(readEntry(zipFile, packageEntry), packageEntry);
            return new EpubArchive(path, zipFile, packageEntry, packageDocument);
        } catch (IOException | RuntimeException ex) {
            zipFile.close();
            throw ex;
        }
    }

    /**
     * Checks the {@code mimetype} entry that every EPUB container starts with.
     */
    static boolean isEpub(Path path) {
        try (ZipFile zipFile = new ZipFile(path.toFile())) {
            if (!zipFile.isValidZipFile()) {
                return false;
            }
            FileHeader header = zipFile.getFileHeader(MIMETYPE_ENTRY);
            if (header == null) {
                return false;
            }
            try (InputStream in = zipFile.getInputStream(header)) {
                return EPUB_MIMETYPE.equals(new String(in.readAllBytes(), StandardCharsets.US_ASCII).trim());
            }
        } catch (IOException ex) {
            return false;
        }
    }

    Path path() {
        return path;
    }

    Optional<String> title() {
        return packageDocument.getElementsByTag("dc:title").stream()
                .map(Element::text)
                .map(TextNormalizer::normalizeSpacing)
                .filter(title -> !title.isEmpty())
                .findFirst();
    }

    /**
     * Reads the navigation entries from the NCX document, or from the EPUB 3 navigation document when the
     * package has no NCX. Entry sources are resolved to archive entry names.
     */
    List<NavigationEntry> navigationEntries() throws IOException {
        Optional<String> ncx = ncxEntry();
        if (ncx.isPresent()) {
            return ncxEntries(ncx.get());
        }
        Optional<String> nav = manifestHref(item -> hasProperty(item, "nav"));
        if (nav.isPresent()) {
            return navDocumentEntries(nav.get());
        }
        return List.of();
    }

    Document readDocument(String entryName) throws IOException {
        byte[] content = readEntry(zipFile, entryName);
        return Jsoup.parse(new ByteArrayInputStream(content), null, entryName);
    }

    @Override
    public void close() throws IOException {
        zipFile.close();
    }

    private Optional<String> ncxEntry() {
        Element spine = packageDocument.selectFirst("spine");
        String tocId = spine == null ? "" : spine.attr("toc");
        if (!tocId.isEmpty()) {
            Optional<String> byId = manifestHref(item -> tocId.equals(item.attr("id")));
            if (byId.isPresent()) {
                return byId;
            }
        }
        return manifestHref(item -> NCX_MEDIA_TYPE.equalsIgnoreCase(item.attr("media-type")));
    }

    private Optional<String> manifestHref(java.util.function.Predicate<Element> filter) {
        return packageDocument.select("manifest > item[href]").stream()
                .filter(filter)
                .map(item -> resolve(packageEntry, item.attr("href")))
                .findFirst();
    }

    private List<NavigationEntry> ncxEntries(String ncxEntryName) throws IOException {
        Document ncx = parseXml(readEntry(zipFile, ncxEntryName), ncxEntryName);
        List<NavigationEntry> entries = new ArrayList<>();
        for (Element navPoint : ncx.select("navPoint")) {
            Element label = firstChild(navPoint, "navLabel");
            Element content = firstChild(navPoint, "content");
            if (content == null || content.attr("src").isEmpty()) {
                continue;
            }
            String text = label == null ? "" : label.text();
            entries.add(new NavigationEntry(text, resolve(ncxEntryName, content.attr("src"))));
        }
        return entries;
    }

    private List<NavigationEntry> navDocumentEntries(String navEntryName) throws IOException {
        Document nav = readDocument(navEntryName);
        List<NavigationEntry> entries = new ArrayList<>();
        for (Element navElement : nav.select("nav")) {
            if (!navElement.attr("epub:type").toLowerCase(Locale.ROOT).contains("toc")) {
                continue;
            }
            for (Element link : navElement.select("a[href]")) {
                entries.add(new NavigationEntry(link.text(), resolve(navEntryName, link.attr("href"))));
            }
        }
        return entries;
    }

    private static Element firstChild(Element parent, String tagName) {
        for (Element child : parent.children()) {
            if (child.tagName().equalsIgnoreCase(tagName)) {
                return child;
            }
        }
        return null;
    }

    private static boolean hasProperty(Element item, String property) {
        for (String value : item.attr("properties").split("\\s+")) {
            if (value.equals(property)) {
                return true;
            }
        }
        return false;
    }

    private static byte[] readEntry(ZipFile zipFile, String entryName) throws IOException {
        FileHeader header = zipFile.getFileHeader(entryName);
        if (header == null) {
            throw new NoSuchFileException(entryName, null, "EPUB entry not found in " + zipFile.getFile());
        }
        try (InputStream in = zipFile.getInputStream(header)) {
            return in.readAllBytes();
        }
    }

    private static Document parseXml(byte[] content, String entryName) throws IOException {
        return Jsoup.parse(new ByteArrayInputStream(content), null, entryName, Parser.xmlParser());
    }

    /**
     * Resolves a relative, percent-encoded reference against the archive entry it appears in.
     */
    static String resolve(String baseEntry, String href) {
        int slash = baseEntry.lastIndexOf('/');
        String directory = slash < 0 ? "" : baseEntry.substring(0, slash + 1);
        int hash = href.indexOf('#');
        String target = hash < 0 ? href : href.substring(0, hash);
        String fragment = hash < 0 ? "" : href.substring(hash);

        Deque<String> segments = new ArrayDeque<>();
        for (String segment : (directory + decode(target)).split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                segments.pollLast();
            } else {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments) + fragment;
    }

    private static String decode(String value) {
        return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    }
}

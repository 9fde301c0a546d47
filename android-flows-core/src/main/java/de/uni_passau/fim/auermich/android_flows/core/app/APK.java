package de.uni_passau.fim.auermich.android_flows.core.app;

import de.uni_passau.fim.auermich.android_flows.core.app.xml.Manifest;
import de.uni_passau.fim.auermich.android_flows.core.errors.AnalysisException;
import de.uni_passau.fim.auermich.android_flows.core.errors.ErrorKind;
import de.uni_passau.fim.auermich.android_flows.core.utility.Utility;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jf.dexlib2.DexFileFactory;
import org.jf.dexlib2.dexbacked.DexBackedDexFile;
import org.jf.util.ExceptionWithContext;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * A wrapper around an APK file: its manifest and the dex files it contains. An APK is an immutable snapshot,
 * all analyses of one session read from the same instance.
 */
public class APK {

    private static final Logger LOGGER = LogManager.getLogger(APK.class);

    /**
     * The default decoding directory. This conforms to the directory when you invoke
     * 'apktool d' without the optional parameter '-o <output-dir>'.
     */
    private static final String DEFAULT_DECODING_DIR = "out";

    private static final String MANIFEST_ENTRY = "AndroidManifest.xml";

    private static final Pattern DEX_ENTRY = Pattern.compile("classes\\d*\\.dex");

    /**
     * The path to the APK file itself.
     */
    private final File apkFile;

    /**
     * References to the dex files contained in the APK, ordered as classes.dex, classes2.dex, ...
     */
    private final List<DexBackedDexFile> dexFiles;

    /**
     * References the AndroidManifest.xml.
     */
    private final Manifest manifest;

    /**
     * Constructs a new APK.
     *
     * @param apkFile The path to the APK file.
     * @param dexFiles The dex files contained in the APK.
     * @param manifest The parsed manifest.
     */
    public APK(File apkFile, List<DexBackedDexFile> dexFiles, Manifest manifest) {
        this.apkFile = apkFile;
        this.dexFiles = List.copyOf(dexFiles);
        this.manifest = manifest;
    }

    /**
     * Opens the given APK file: validates the archive, parses the manifest and loads the dex files.
     *
     * @param apkFile The path to the APK file.
     * @return Returns the opened APK.
     * @throws AnalysisException If the archive is missing or corrupt ({@link ErrorKind#INVALID_ARCHIVE}), has no
     *         manifest ({@link ErrorKind#MISSING_MANIFEST}, {@link ErrorKind#INVALID_MANIFEST}) or no loadable
     *         dex file ({@link ErrorKind#MALFORMED_DEX}).
     */
    public static APK open(File apkFile) {

        if (!apkFile.isFile()) {
            throw new AnalysisException(ErrorKind.INVALID_ARCHIVE, "APK file doesn't exist: " + apkFile);
        }

        LOGGER.info("Opening APK " + apkFile.getName());
        Manifest manifest = readManifest(apkFile);
        List<DexBackedDexFile> dexFiles = loadDexFiles(apkFile);
        LOGGER.info("Loaded " + dexFiles.size() + " dex files of package " + manifest.getPackageName());
        return new APK(apkFile, dexFiles, manifest);
    }

    /**
     * Reads the manifest of the APK. A textual manifest is parsed directly. The binary (AXML) encoding is
     * not decoded here; instead the manifest decoded by 'apktool d' into the default decoding directory next
     * to the APK is used.
     *
     * @param apkFile The path to the APK file.
     * @return Returns the parsed manifest.
     */
    private static Manifest readManifest(File apkFile) {

        byte[] content;

        try (ZipFile zipFile = new ZipFile(apkFile)) {
            ZipEntry entry = zipFile.getEntry(MANIFEST_ENTRY);
            if (entry == null) {
                throw new AnalysisException(ErrorKind.MISSING_MANIFEST, "No " + MANIFEST_ENTRY + " in " + apkFile);
            }
            try (InputStream inputStream = zipFile.getInputStream(entry)) {
                content = inputStream.readAllBytes();
            }
        } catch (IOException e) {
            throw new AnalysisException(ErrorKind.INVALID_ARCHIVE, "Couldn't read APK " + apkFile, e);
        }

        if (isTextualXml(content)) {
            return Manifest.parse(new ByteArrayInputStream(content));
        }

        File decodedManifest = new File(getDecodingOutputPath(apkFile), MANIFEST_ENTRY);
        if (decodedManifest.isFile()) {
            LOGGER.debug("Using decoded manifest " + decodedManifest);
            return Manifest.parse(decodedManifest);
        }

        throw new AnalysisException(ErrorKind.INVALID_MANIFEST, "The manifest of " + apkFile.getName()
                + " is binary encoded; decode the APK with 'apktool d' into " + getDecodingOutputPath(apkFile));
    }

    private static boolean isTextualXml(byte[] content) {
        for (byte b : content) {
            if (!Character.isWhitespace(b) && (b & 0xFF) != 0xEF && (b & 0xFF) != 0xBB && (b & 0xFF) != 0xBF) {
                return b == '<';
            }
        }
        return false;
    }

    private static List<DexBackedDexFile> loadDexFiles(File apkFile) {

        List<DexBackedDexFile> dexFiles = new ArrayList<>();

        try {
            var container = DexFileFactory.loadDexContainer(apkFile, Utility.API_OPCODE);
            List<String> entryNames = new ArrayList<>(container.getDexEntryNames());
            entryNames.removeIf(name -> !DEX_ENTRY.matcher(name).matches());
            entryNames.sort(Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder()));

            for (String entryName : entryNames) {
                var entry = container.getEntry(entryName);
                if (entry != null) {
                    dexFiles.add(entry.getDexFile());
                }
            }
        } catch (IOException e) {
            throw new AnalysisException(ErrorKind.INVALID_ARCHIVE, "Couldn't read APK " + apkFile, e);
        } catch (ExceptionWithContext e) {
            throw new AnalysisException(ErrorKind.MALFORMED_DEX, "Couldn't load dex files of " + apkFile, e);
        }

        if (dexFiles.isEmpty()) {
            throw new AnalysisException(ErrorKind.MALFORMED_DEX, "No dex file found in " + apkFile);
        }
        return dexFiles;
    }

    private static File getDecodingOutputPath(File apkFile) {
        return new File(apkFile.getAbsoluteFile().getParentFile(), DEFAULT_DECODING_DIR);
    }

    /**
     * Returns the path of the APK file.
     *
     * @return Returns the path of the APK file.
     */
    public File getApkFile() {
        return apkFile;
    }

    /**
     * Returns the dex files contained in the APK file.
     *
     * @return Returns a read-only view on the dex files.
     */
    public List<DexBackedDexFile> getDexFiles() {
        return Collections.unmodifiableList(dexFiles);
    }

    public Manifest getManifest() {
        return manifest;
    }

    /**
     * Returns the directory 'apktool d' decodes the APK into by default.
     *
     * @return Returns the decoding directory, which may not exist.
     */
    public File getDecodingOutputPath() {
        return getDecodingOutputPath(apkFile);
    }
}

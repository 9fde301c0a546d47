package de.uni_passau.fim.auermich.android_flows.core;

import de.uni_passau.fim.auermich.android_flows.core.app.components.ComponentType;
import de.uni_passau.fim.auermich.android_flows.core.app.xml.IntentFilter;
import de.uni_passau.fim.auermich.android_flows.core.app.xml.IntentFilterData;
import de.uni_passau.fim.auermich.android_flows.core.app.xml.Manifest;
import de.uni_passau.fim.auermich.android_flows.core.app.xml.ManifestComponent;
import de.uni_passau.fim.auermich.android_flows.core.dex.ClassTable;
import de.uni_passau.fim.auermich.android_flows.core.dex.DexClass;
import de.uni_passau.fim.auermich.android_flows.core.dex.DexField;
import de.uni_passau.fim.auermich.android_flows.core.dex.DexMethod;
import de.uni_passau.fim.auermich.android_flows.core.dex.MethodReference;
import de.uni_passau.fim.auermich.android_flows.core.dex.ReferenceTable;
import org.jf.dexlib2.AccessFlags;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A hand-assembled app with two activities of package {@code com.x}:
 * <pre>
 * MainActivity.onCreate(Bundle)     this.b()
 * MainActivity.b()                  this.webView.loadUrl("https://example.com")
 *
 * DeeplinkActivity.onCreate(Bundle) this.open(getIntent().getStringExtra("url"))
 * DeeplinkActivity.open(String)     this.webView.loadUrl(url)
 * </pre>
 * MainActivity is the launcher, DeeplinkActivity handles {@code x://open} links.
 */
public final class SyntheticApp {

    public static final String PACKAGE = "com.x";
    public static final String MAIN_ACTIVITY = "com.x.MainActivity";
    public static final String DEEPLINK_ACTIVITY = "com.x.DeeplinkActivity";

    public static final MethodReference MAIN_ON_CREATE =
            new MethodReference(MAIN_ACTIVITY, "onCreate", List.of("android.os.Bundle"), "void");
    public static final MethodReference MAIN_B = new MethodReference(MAIN_ACTIVITY, "b", List.of(), "void");
    public static final MethodReference LOAD_URL =
            new MethodReference("android.webkit.WebView", "loadUrl", List.of("java.lang.String"), "void");
    public static final MethodReference GET_INTENT =
            new MethodReference("android.app.Activity", "getIntent", List.of(), "android.content.Intent");
    public static final MethodReference GET_STRING_EXTRA = new MethodReference("android.content.Intent",
            "getStringExtra", List.of("java.lang.String"), "java.lang.String");
    public static final MethodReference DEEPLINK_ON_CREATE =
            new MethodReference(DEEPLINK_ACTIVITY, "onCreate", List.of("android.os.Bundle"), "void");
    public static final MethodReference DEEPLINK_OPEN =
            new MethodReference(DEEPLINK_ACTIVITY, "open", List.of("java.lang.String"), "void");

    /**
     * Method indices 0..5, field indices 0..1 and string indices 0..1 of the reference table.
     */
    public static final List<MethodReference> METHOD_TABLE = List.of(MAIN_ON_CREATE, MAIN_B, LOAD_URL, GET_INTENT,
            GET_STRING_EXTRA, DEEPLINK_OPEN);

    public static final List<String> FIELD_TABLE = List.of("com.x.MainActivity.webView",
            "com.x.DeeplinkActivity.webView");

    public static final List<String> STRING_TABLE = List.of("https://example.com", "url");

    private SyntheticApp() {
        throw new UnsupportedOperationException("Utility class!");
    }

    public static ClassTable classTable() {
        return new ClassTable(List.of(mainActivity(), deeplinkActivity()),
                List.of(new ReferenceTable(0, METHOD_TABLE, FIELD_TABLE, STRING_TABLE)), List.of());
    }

    public static DexClass mainActivity() {

        // invoke-virtual {v0}, method@1; return-void
        DexMethod onCreate = new DexMethod(MAIN_ACTIVITY, "onCreate", List.of("android.os.Bundle"), "void",
                AccessFlags.PROTECTED.getValue(), 2, new short[]{0x106e, 0x0001, 0x0000, 0x000e});

        // iget-object v0, v2, field@0; const-string v1, string@0; invoke-virtual {v0, v1}, method@2; return-void
        DexMethod b = new DexMethod(MAIN_ACTIVITY, "b", List.of(), "void", AccessFlags.PRIVATE.getValue(), 3,
                new short[]{0x2054, 0x0000, 0x011a, 0x0000, 0x206e, 0x0002, 0x0010, 0x000e});

        return new DexClass(MAIN_ACTIVITY, "android.app.Activity", Set.of(), AccessFlags.PUBLIC.getValue(),
                List.of(onCreate, b), List.of(webViewField(MAIN_ACTIVITY)), 0);
    }

    public static DexClass deeplinkActivity() {

        DexMethod onCreate = new DexMethod(DEEPLINK_ACTIVITY, "onCreate", List.of("android.os.Bundle"), "void",
                AccessFlags.PROTECTED.getValue(), 4, new short[]{
                0x106e, 0x0003, 0x0002,     // invoke-virtual {v2}, method@3 (getIntent)
                0x000c,                     // move-result-object v0
                0x011a, 0x0001,             // const-string v1, string@1
                0x206e, 0x0004, 0x0010,     // invoke-virtual {v0, v1}, method@4 (getStringExtra)
                0x000c,                     // move-result-object v0
                0x206e, 0x0005, 0x0002,     // invoke-virtual {v2, v0}, method@5 (open)
                0x000e                      // return-void
        });

        DexMethod open = new DexMethod(DEEPLINK_ACTIVITY, "open", List.of("java.lang.String"), "void",
                AccessFlags.PRIVATE.getValue(), 3, new short[]{
                0x1054, 0x0001,             // iget-object v0, v1, field@1
                0x206e, 0x0002, 0x0020,     // invoke-virtual {v0, v2}, method@2 (loadUrl)
                0x000e                      // return-void
        });

        return new DexClass(DEEPLINK_ACTIVITY, "android.app.Activity", Set.of(), AccessFlags.PUBLIC.getValue(),
                List.of(onCreate, open), List.of(webViewField(DEEPLINK_ACTIVITY)), 0);
    }

    private static DexField webViewField(String className) {
        return new DexField(className, "webView", "android.webkit.WebView", AccessFlags.PRIVATE.getValue(), null);
    }

    public static Manifest manifest() {

        IntentFilter launcher = new IntentFilter(Set.of(IntentFilter.ACTION_MAIN),
                Set.of(IntentFilter.CATEGORY_LAUNCHER), List.of());

        IntentFilter deeplink = new IntentFilter(Set.of(IntentFilter.ACTION_VIEW),
                new LinkedHashSet<>(List.of(IntentFilter.CATEGORY_DEFAULT, IntentFilter.CATEGORY_BROWSABLE)),
                List.of(new IntentFilterData.Builder().withScheme("x").withHost("open").build()));

        return new Manifest(PACKAGE, List.of(
                new ManifestComponent(MAIN_ACTIVITY, ComponentType.ACTIVITY, true, List.of(launcher)),
                new ManifestComponent(DEEPLINK_ACTIVITY, ComponentType.ACTIVITY, true, List.of(deeplink)),
                new ManifestComponent("com.x.MissingService", ComponentType.SERVICE, false, List.of())));
    }
}

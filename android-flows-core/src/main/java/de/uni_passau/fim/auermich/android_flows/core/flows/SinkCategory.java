package de.uni_passau.fim.auermich.android_flows.core.flows;

import java.util.List;

/**
 * Groups of security sensitive framework methods. A pattern matches every method whose qualified name
 * ({@code class.method}) contains it, e.g. {@code WebView.loadUrl} matches
 * {@code android.webkit.WebView.loadUrl(java.lang.String): void}.
 */
public enum SinkCategory {

    WEBVIEW(List.of(
            "WebView.loadUrl",
            "WebView.loadData",
            "WebView.loadDataWithBaseURL",
            "WebView.evaluateJavascript",
            "WebView.addJavascriptInterface",
            "WebView.setWebViewClient",
            "WebView.setWebChromeClient")),

    FILE(List.of(
            "FileOutputStream.<init>",
            "FileOutputStream.write",
            "FileWriter.<init>",
            "FileWriter.write",
            "RandomAccessFile.write",
            "Files.write")),

    NETWORK(List.of(
            "HttpURLConnection",
            "OkHttp",
            "URLConnection.connect",
            "Socket.connect")),

    SQL(List.of(
            "SQLiteDatabase.execSQL",
            "SQLiteDatabase.rawQuery",
            "SQLiteDatabase.query"));

    private final List<String> patterns;

    SinkCategory(List<String> patterns) {
        this.patterns = patterns;
    }

    public List<String> getPatterns() {
        return patterns;
    }
}

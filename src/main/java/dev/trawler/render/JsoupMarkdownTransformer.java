package dev.trawler.render;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * {@link ContentTransformer} built on jsoup. Boilerplate containers (navigation, headers, footers,
 * scripts) are dropped, the main content element is preferred over the whole body, and the
 * remaining tree is written out as CommonMark-style Markdown. Links are collected from the whole
 * document so navigation still feeds the crawl frontier.
 */
@Component
public class JsoupMarkdownTransformer implements ContentTransformer {

  private static final String BOILERPLATE =
      "script, style, noscript, template, svg, iframe, form, nav, header, footer, aside";
  private static final String MAIN_CONTENT = "main, article, [role=main]";

  @Override
  public TransformedPage toMarkdown(String html, String baseUrl) {
    Document doc = Jsoup.parse(html == null ? "" : html, baseUrl);
    PageMetadata metadata = new PageMetadata(title(doc), description(doc), baseUrl);
    List<String> outlinks = outlinks(doc);

    doc.select(BOILERPLATE).remove();
    Element root = doc.selectFirst(MAIN_CONTENT);
    if (root == null) {
      root = doc.body();
    }

    StringBuilder out = new StringBuilder();
    if (root != null) {
      renderBlockChildren(root, out, "");
    }
    return new TransformedPage(tidy(out.toString()), metadata, outlinks);
  }

  private static @Nullable String title(Document doc) {
    String title = doc.title();
    if (!title.isBlank()) {
      return title.trim();
    }
    String ogTitle = metaContent(doc, "meta[property=og:title]");
    if (ogTitle != null) {
      return ogTitle;
    }
    Element h1 = doc.selectFirst("h1");
    return h1 != null && !h1.text().isBlank() ? h1.text().trim() : null;
  }

  private static @Nullable String description(Document doc) {
    String description = metaContent(doc, "meta[name=description]");
    return description != null ? description : metaContent(doc, "meta[property=og:description]");
  }

  private static @Nullable String metaContent(Document doc, String selector) {
    Element meta = doc.selectFirst(selector);
    if (meta == null) {
      return null;
    }
    String content = meta.attr("content").trim();
    return content.isEmpty() ? null : content;
  }

  private static List<String> outlinks(Document doc) {
    Set<String> links = new LinkedHashSet<>();
    for (Element a : doc.select("a[href]")) {
      String href = a.attr("abs:href");
      String lower = href.toLowerCase(Locale.ROOT);
      if (lower.startsWith("http://") || lower.startsWith("https://")) {
        links.add(href);
      }
    }
    return new ArrayList<>(links);
  }

  private void renderBlockChildren(Element parent, StringBuilder out, String indent) {
    StringBuilder inline = new StringBuilder();
    for (Node child : parent.childNodes()) {
      if (child instanceof Element el && isBlock(el)) {
        flushParagraph(inline, out, indent);
        renderBlock(el, out, indent);
      } else {
        renderInline(child, inline);
      }
    }
    flushParagraph(inline, out, indent);
  }

  private void renderBlock(Element el, StringBuilder out, String indent) {
    String tag = el.normalName();
    switch (tag) {
      case "h1", "h2", "h3", "h4", "h5", "h6" -> {
        String text = inlineText(el);
        if (!text.isEmpty()) {
          int level = tag.charAt(1) - '0';
          out.append(indent).append("#".repeat(level)).append(' ').append(text).append("\n\n");
        }
      }
      case "p" -> {
        StringBuilder inline = new StringBuilder();
        renderInlineChildren(el, inline);
        flushParagraph(inline, out, indent);
      }
      case "pre" -> {
        Element code = el.selectFirst("code");
        String language = code == null ? "" : languageOf(code);
        String body = code == null ? el.wholeText() : code.wholeText();
        out.append(indent).append("```").append(language).append('\n');
        for (String line : stripTrailingNewlines(body).split("\n", -1)) {
          out.append(indent).append(line).append('\n');
        }
        out.append(indent).append("```\n\n");
      }
      case "ul", "ol" -> {
        renderList(el, out, indent, "ol".equals(tag));
        out.append('\n');
      }
      case "blockquote" -> {
        StringBuilder quoted = new StringBuilder();
        renderBlockChildren(el, quoted, "");
        for (String line : tidy(quoted.toString()).split("\n")) {
          out.append(indent).append(line.isEmpty() ? ">" : "> " + line).append('\n');
        }
        out.append('\n');
      }
      case "hr" -> out.append(indent).append("---\n\n");
      case "table" -> renderTable(el, out, indent);
      default -> renderBlockChildren(el, out, indent);
    }
  }

  private void renderList(Element list, StringBuilder out, String indent, boolean ordered) {
    int index = 1;
    for (Element item : list.children()) {
      if (!"li".equals(item.normalName())) {
        continue;
      }
      String marker = ordered ? index++ + ". " : "- ";
      StringBuilder inline = new StringBuilder();
      List<Element> nested = new ArrayList<>();
      for (Node child : item.childNodes()) {
        if (child instanceof Element el && isList(el)) {
          nested.add(el);
        } else if (child instanceof Element block && isBlock(block)) {
          renderInlineChildren(block, inline);
          inline.append(' ');
        } else {
          renderInline(child, inline);
        }
      }
      out.append(indent).append(marker).append(collapse(inline.toString())).append('\n');
      for (Element sub : nested) {
        renderList(sub, out, indent + "  ", "ol".equals(sub.normalName()));
      }
    }
  }

  private void renderTable(Element table, StringBuilder out, String indent) {
    List<List<String>> rows = new ArrayList<>();
    for (Element tr : table.select("tr")) {
      List<String> cells = new ArrayList<>();
      for (Element cell : tr.select("th, td")) {
        cells.add(inlineText(cell).replace("|", "\\|"));
      }
      if (!cells.isEmpty()) {
        rows.add(cells);
      }
    }
    if (rows.isEmpty()) {
      return;
    }
    int columns = rows.stream().mapToInt(List::size).max().orElse(0);
    for (int r = 0; r < rows.size(); r++) {
      List<String> cells = new ArrayList<>(rows.get(r));
      while (cells.size() < columns) {
        cells.add("");
      }
      out.append(indent).append("| ").append(String.join(" | ", cells)).append(" |\n");
      if (r == 0) {
        out.append(indent).append("|").append(" --- |".repeat(columns)).append('\n');
      }
    }
    out.append('\n');
  }

  private void renderInlineChildren(Element el, StringBuilder inline) {
    for (Node child : el.childNodes()) {
      renderInline(child, inline);
    }
  }

  private void renderInline(Node node, StringBuilder inline) {
    if (node instanceof TextNode text) {
      inline.append(text.text());
      return;
    }
    if (!(node instanceof Element el)) {
      return;
    }
    switch (el.normalName()) {
      case "br" -> inline.append("  \n");
      case "strong", "b" -> wrap(el, inline, "**");
      case "em", "i" -> wrap(el, inline, "*");
      case "code" -> inline.append('`').append(el.text()).append('`');
      case "a" -> {
        String label = inlineText(el);
        String href = el.attr("abs:href");
        if (href.isEmpty() || label.isEmpty()) {
          inline.append(label);
        } else {
          inline.append('[').append(label).append("](").append(href).append(')');
        }
      }
      case "img" -> {
        String src = el.attr("abs:src");
        if (!src.isEmpty()) {
          inline.append("![").append(el.attr("alt")).append("](").append(src).append(')');
        }
      }
      default -> renderInlineChildren(el, inline);
    }
  }

  private void wrap(Element el, StringBuilder inline, String marker) {
    String text = inlineText(el);
    if (!text.isEmpty()) {
      inline.append(marker).append(text).append(marker);
    }
  }

  private String inlineText(Element el) {
    StringBuilder inline = new StringBuilder();
    renderInlineChildren(el, inline);
    return collapse(inline.toString());
  }

  private static void flushParagraph(StringBuilder inline, StringBuilder out, String indent) {
    String text = collapse(inline.toString());
    inline.setLength(0);
    if (!text.isEmpty()) {
      out.append(indent).append(text).append("\n\n");
    }
  }

  private static boolean isList(Element el) {
    return "ul".equals(el.normalName()) || "ol".equals(el.normalName());
  }

  private static boolean isBlock(Element el) {
    return switch (el.normalName()) {
      case "p", "div", "section", "main", "article", "h1", "h2", "h3", "h4", "h5", "h6", "pre",
          "ul", "ol", "blockquote", "hr", "table", "figure", "dl", "body" -> true;
      default -> false;
    };
  }

  private static String languageOf(Element code) {
    for (String cls : code.classNames()) {
      if (cls.startsWith("language-")) {
        return cls.substring("language-".length());
      }
      if (cls.startsWith("lang-")) {
        return cls.substring("lang-".length());
      }
    }
    return "";
  }

  /** Collapse runs of whitespace, keeping hard line breaks. */
  private static String collapse(String text) {
    String[] lines = text.split("  \n", -1);
    List<String> collapsed = new ArrayList<>();
    for (String line : lines) {
      collapsed.add(line.replaceAll("\\s+", " ").trim());
    }
    return String.join("  \n", collapsed).trim();
  }

  private static String stripTrailingNewlines(String text) {
    int end = text.length();
    while (end > 0 && text.charAt(end - 1) == '\n') {
      end--;
    }
    return text.substring(0, end);
  }

  private static String tidy(String markdown) {
    return markdown.replaceAll("\n{3,}", "\n\n").strip() + "\n";
  }
}

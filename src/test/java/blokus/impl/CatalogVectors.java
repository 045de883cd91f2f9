package blokus.impl;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Expected per-piece figures for the standard set on a 20x20 board,
 * read from {@code /catalog/pieces.txt}.
 */
final class CatalogVectors {

  record Row(int index, String name, int cells, int orientations, int placements) {}

  private CatalogVectors() {}

  static List<Row> load() {
    List<Row> rows = new ArrayList<>();
    try (InputStream is = CatalogVectors.class.getResourceAsStream("/catalog/pieces.txt");
         BufferedReader br = new BufferedReader(
                 new InputStreamReader(Objects.requireNonNull(is), StandardCharsets.UTF_8))) {
      br.lines()
              .map(String::trim)
              .filter(l -> !(l.isEmpty() || l.startsWith("#")))
              .forEach(l -> {
                String[] p = l.split(";");
                rows.add(new Row(
                        Integer.parseInt(p[0].trim()),
                        p[1].trim(),
                        Integer.parseInt(p[2].trim()),
                        Integer.parseInt(p[3].trim()),
                        Integer.parseInt(p[4].trim())));
              });
    } catch (java.io.IOException e) {
      throw new IllegalStateException("cannot read catalog vectors", e);
    }
    if (rows.isEmpty()) throw new IllegalStateException("no catalog vectors found");
    return rows;
  }
}

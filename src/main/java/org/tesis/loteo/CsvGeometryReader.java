package org.tesis.loteo;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class CsvGeometryReader {

    // función para leer un CSV y devolver la lista de vértices
    static List<VertexRow> readCsv(Path path) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readCsv(br, path.toString());
        }
    }

    static List<VertexRow> readCsv(BufferedReader br, String source) throws IOException {
        List<VertexRow> out = new ArrayList<>();
        String header = br.readLine();
        if (header == null) throw new IOException("CSV vacío: " + source);
        String[] h = VertexRow.splitCsv(header);
        String line;
        while ((line = br.readLine()) != null) {
            if (line.trim().isEmpty() || line.startsWith("#")) continue;
            String[] v = VertexRow.splitCsv(line);
            out.add(VertexRow.fromCsv(h, v));
        }
        return out;
    }
}

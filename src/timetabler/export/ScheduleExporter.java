package timetabler.export;

import com.lowagie.text.Document;
import com.lowagie.text.DocumentException;
import com.lowagie.text.Element;
import com.lowagie.text.Font;
import com.lowagie.text.FontFactory;
import com.lowagie.text.PageSize;
import com.lowagie.text.Paragraph;
import com.lowagie.text.Phrase;
import com.lowagie.text.pdf.PdfPCell;
import com.lowagie.text.pdf.PdfPTable;
import com.lowagie.text.pdf.PdfWriter;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes timetable rows (as produced by {@link ResultReporter#rows}, header
 * row first) to Excel, PDF or CSV.
 */
public class ScheduleExporter {

    private static final Logger log = LoggerFactory.getLogger(ScheduleExporter.class);

    private static final Font HEADER_FONT = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 10);
    private static final Font CELL_FONT = FontFactory.getFont(FontFactory.HELVETICA, 10);

    public static void exportExcel(List<String[]> rows, Path outputPath) throws IOException {
        if (outputPath == null) throw new IllegalArgumentException("outputPath is null");
        int cols = columnCount(rows);

        try (XSSFWorkbook wb = new XSSFWorkbook()) {
            Sheet sheet = wb.createSheet("Schedule");

            int r = 0;
            if (rows != null) {
                for (String[] rowData : rows) {
                    Row row = sheet.createRow(r++);
                    if (rowData == null) continue;
                    for (int c = 0; c < rowData.length; c++) {
                        Cell cell = row.createCell(c);
                        String v = rowData[c] == null ? "" : rowData[c];
                        // integer data cells are stored as numbers
                        if (r > 1 && v.matches("-?\\d+")) {
                            cell.setCellValue(Long.parseLong(v));
                        } else {
                            cell.setCellValue(v);
                        }
                    }
                }
            }

            // column width from content length
            for (int c = 0; c < cols; c++) {
                sheet.setColumnWidth(c, Math.min(255, maxLength(rows, c) + 2) * 256);
            }

            try (OutputStream out = Files.newOutputStream(outputPath)) {
                wb.write(out);
            }
        }
        log.info("Exported {} row(s) to {}", Math.max(0, size(rows) - 1), outputPath);
    }

    public static void exportPdf(List<String[]> rows, Path outputPath) throws IOException {
        if (outputPath == null) throw new IllegalArgumentException("outputPath is null");
        int cols = Math.max(1, columnCount(rows));
        List<String[]> body = rows == null || rows.isEmpty() ? List.of() : rows.subList(1, rows.size());

        ByteArrayOutputStream pdf = new ByteArrayOutputStream();
        Document doc = new Document(PageSize.A4);
        try {
            PdfWriter.getInstance(doc, pdf);
            doc.open();

            Paragraph title = new Paragraph("Exam Timetable", FontFactory.getFont(FontFactory.HELVETICA_BOLD, 14));
            title.setAlignment(Element.ALIGN_CENTER);
            title.setSpacingAfter(12f);
            doc.add(title);

            PdfPTable table = new PdfPTable(cols);
            table.setWidthPercentage(100);
            if (rows != null && !rows.isEmpty() && rows.get(0) != null) {
                addRow(table, rows.get(0), cols, HEADER_FONT, true);
                table.setHeaderRows(1);
            }
            for (String[] row : body) {
                if (row != null) addRow(table, row, cols, CELL_FONT, false);
            }
            if (table.size() == 0) {
                addRow(table, new String[]{"(empty)"}, cols, CELL_FONT, false);
            }
            doc.add(table);
        } catch (DocumentException e) {
            throw new IOException("Could not build PDF for " + outputPath, e);
        } finally {
            if (doc.isOpen()) doc.close();
        }

        // nothing touches the target until the document is complete
        Files.write(outputPath, pdf.toByteArray());
        log.info("Exported {} row(s) to {}", body.size(), outputPath);
    }

    private static void addRow(PdfPTable table, String[] values, int cols, Font font, boolean header) {
        for (int c = 0; c < cols; c++) {
            String v = c < values.length && values[c] != null ? values[c] : "";
            PdfPCell cell = new PdfPCell(new Phrase(v, font));
            cell.setPadding(header ? 4f : 3f);
            cell.setHorizontalAlignment(header ? Element.ALIGN_CENTER : Element.ALIGN_RIGHT);
            table.addCell(cell);
        }
    }

    public static void exportCsv(List<String[]> rows, Path outputPath) throws IOException {
        if (outputPath == null) throw new IllegalArgumentException("outputPath is null");
        try (BufferedWriter w = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            if (rows != null) {
                for (String[] row : rows) {
                    if (row == null) continue;
                    w.write(String.join(",", row));
                    w.newLine();
                }
            }
        }
        log.info("Exported {} row(s) to {}", Math.max(0, size(rows) - 1), outputPath);
    }

    private static int columnCount(List<String[]> rows) {
        int cols = 0;
        if (rows != null) {
            for (String[] r : rows) {
                if (r != null) cols = Math.max(cols, r.length);
            }
        }
        return cols;
    }

    private static int maxLength(List<String[]> rows, int col) {
        int max = 0;
        for (String[] r : rows) {
            if (r != null && col < r.length && r[col] != null) max = Math.max(max, r[col].length());
        }
        return max;
    }

    private static int size(List<String[]> rows) {
        return rows == null ? 0 : rows.size();
    }
}

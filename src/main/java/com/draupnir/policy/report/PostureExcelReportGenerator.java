package com.draupnir.policy.report;

import com.draupnir.policy.model.report.PostureChecklist;
import com.draupnir.policy.model.report.PostureDetail;
import com.draupnir.policy.model.report.PostureStats;
import com.draupnir.policy.model.report.ValidationReport;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Generates Excel reports from posture checklists and validation findings
 */
@Slf4j
public class PostureExcelReportGenerator {

    static final String SHEET_SUMMARY = "Summary";
    static final String SHEET_DETAILS = "Details";
    static final String SHEET_FINDINGS = "Findings";

    static final String YES = "YES";
    static final String NO = "NO";

    /**
     * Generate an Excel report file
     *
     * @param checklist Posture scan result
     * @param findings Validation reports for the same files, may be empty
     * @param outputPath Path to output Excel file
     */
    public void generateReport(PostureChecklist checklist,
                               List<ValidationReport> findings,
                               String outputPath) throws IOException {

        log.info("Generating Excel report to: {}", outputPath);

        try (OutputStream fileOut = new FileOutputStream(outputPath)) {
            write(checklist, findings, fileOut);
        }
        log.info("Excel report generated successfully: {}", outputPath);
    }

    /**
     * Write the workbook to a stream; the stream is left open
     */
    public void write(PostureChecklist checklist,
                      List<ValidationReport> findings,
                      OutputStream out) throws IOException {

        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle headerStyle = createHeaderStyle(workbook);
            CellStyle passStyle = createFillStyle(workbook, IndexedColors.LIGHT_GREEN);
            CellStyle failStyle = createFillStyle(workbook, IndexedColors.CORAL);
            CellStyle warnStyle = createFillStyle(workbook, IndexedColors.LIGHT_ORANGE);

            generateSummarySheet(workbook, checklist.getStats(), headerStyle);
            generateDetailsSheet(workbook, checklist.getDetails(), headerStyle, passStyle, failStyle);
            generateFindingsSheet(workbook, findings, headerStyle, failStyle, warnStyle);

            workbook.write(out);
        }
    }

    /**
     * Columns: Metric | Value
     */
    private void generateSummarySheet(Workbook workbook, PostureStats stats, CellStyle headerStyle) {
        Sheet sheet = workbook.createSheet(SHEET_SUMMARY);

        Row headerRow = sheet.createRow(0);
        createCell(headerRow, 0, "Metric", headerStyle);
        createCell(headerRow, 1, "Value", headerStyle);

        int rowNum = 1;
        rowNum = createMetricRow(sheet, rowNum, "Total policies", stats.getTotal());
        rowNum = createMetricRow(sheet, rowNum, "CiliumNetworkPolicy", stats.getCnpCount());
        rowNum = createMetricRow(sheet, rowNum, "CiliumClusterwideNetworkPolicy", stats.getCcnpCount());
        rowNum = createMetricRow(sheet, rowNum, "With L7 ports", stats.getWithL7Count());
        createMetricRow(sheet, rowNum, "DNS egress handled", stats.getDnsOkCount());

        sheet.setColumnWidth(0, 10000);
        sheet.setColumnWidth(1, 4000);
    }

    /**
     * Columns: STT | Path | Kind | L7 | DNS
     */
    private void generateDetailsSheet(Workbook workbook,
                                      List<PostureDetail> details,
                                      CellStyle headerStyle,
                                      CellStyle passStyle,
                                      CellStyle failStyle) {

        Sheet sheet = workbook.createSheet(SHEET_DETAILS);

        Row headerRow = sheet.createRow(0);
        createCell(headerRow, 0, "STT", headerStyle);
        createCell(headerRow, 1, "Path", headerStyle);
        createCell(headerRow, 2, "Kind", headerStyle);
        createCell(headerRow, 3, "L7", headerStyle);
        createCell(headerRow, 4, "DNS", headerStyle);

        int rowNum = 1;
        for (PostureDetail detail : details) {
            Row row = sheet.createRow(rowNum++);
            createCell(row, 0, String.valueOf(rowNum - 1), null);
            createCell(row, 1, detail.getPath(), null);
            createCell(row, 2, detail.getKind(), null);
            createCell(row, 3, detail.isHasL7() ? YES : NO, detail.isHasL7() ? passStyle : failStyle);
            createCell(row, 4, detail.isDnsHandled() ? YES : NO, detail.isDnsHandled() ? passStyle : failStyle);
        }

        // Set column widths manually (no AWT in headless mode)
        sheet.setColumnWidth(0, 2000);
        sheet.setColumnWidth(1, 14000);
        sheet.setColumnWidth(2, 10000);
        sheet.setColumnWidth(3, 3000);
        sheet.setColumnWidth(4, 3000);
    }

    /**
     * Columns: STT | Path | Severity | Message. One row per finding.
     */
    private void generateFindingsSheet(Workbook workbook,
                                       List<ValidationReport> findings,
                                       CellStyle headerStyle,
                                       CellStyle failStyle,
                                       CellStyle warnStyle) {

        Sheet sheet = workbook.createSheet(SHEET_FINDINGS);

        Row headerRow = sheet.createRow(0);
        createCell(headerRow, 0, "STT", headerStyle);
        createCell(headerRow, 1, "Path", headerStyle);
        createCell(headerRow, 2, "Severity", headerStyle);
        createCell(headerRow, 3, "Message", headerStyle);

        int rowNum = 1;
        for (ValidationReport report : findings) {
            for (String error : report.getErrors()) {
                rowNum = createFindingRow(sheet, rowNum, report.getPath(), "ERROR", error, failStyle);
            }
            for (String warning : report.getWarnings()) {
                rowNum = createFindingRow(sheet, rowNum, report.getPath(), "WARNING", warning, warnStyle);
            }
        }

        sheet.setColumnWidth(0, 2000);
        sheet.setColumnWidth(1, 14000);
        sheet.setColumnWidth(2, 4000);
        sheet.setColumnWidth(3, 20000);
    }

    private int createMetricRow(Sheet sheet, int rowNum, String label, int value) {
        Row row = sheet.createRow(rowNum);
        createCell(row, 0, label, null);
        row.createCell(1).setCellValue(value);
        return rowNum + 1;
    }

    private int createFindingRow(Sheet sheet, int rowNum, String path, String severity, String message, CellStyle style) {
        Row row = sheet.createRow(rowNum);
        createCell(row, 0, String.valueOf(rowNum), null);
        createCell(row, 1, path, null);
        createCell(row, 2, severity, style);
        createCell(row, 3, message, null);
        return rowNum + 1;
    }

    private void createCell(Row row, int column, String value, CellStyle style) {
        Cell cell = row.createCell(column);
        cell.setCellValue(value);
        if (style != null) {
            cell.setCellStyle(style);
        }
    }

    private CellStyle createHeaderStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        font.setColor(IndexedColors.WHITE.getIndex());
        style.setFont(font);
        style.setFillForegroundColor(IndexedColors.DARK_BLUE.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setAlignment(HorizontalAlignment.CENTER);
        setThinBorders(style);
        return style;
    }

    private CellStyle createFillStyle(Workbook workbook, IndexedColors color) {
        CellStyle style = workbook.createCellStyle();
        style.setFillForegroundColor(color.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        setThinBorders(style);
        return style;
    }

    private void setThinBorders(CellStyle style) {
        style.setBorderBottom(BorderStyle.THIN);
        style.setBorderTop(BorderStyle.THIN);
        style.setBorderLeft(BorderStyle.THIN);
        style.setBorderRight(BorderStyle.THIN);
    }
}

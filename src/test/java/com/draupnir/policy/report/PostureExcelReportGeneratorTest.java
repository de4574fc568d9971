package com.draupnir.policy.report;

import com.draupnir.policy.model.report.PostureChecklist;
import com.draupnir.policy.model.report.PostureDetail;
import com.draupnir.policy.model.report.PostureStats;
import com.draupnir.policy.model.report.ValidationReport;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PostureExcelReportGeneratorTest {

    @Test
    @DisplayName("Workbook has summary, details and findings sheets")
    void testGenerateReport(@TempDir Path dir) throws Exception {
        PostureStats stats = PostureStats.builder()
                .total(2).cnpCount(2).ccnpCount(0).withL7Count(1).dnsOkCount(1)
                .build();
        PostureChecklist checklist = new PostureChecklist(stats, List.of(
                PostureDetail.builder().path("a.yaml").kind("CiliumNetworkPolicy").hasL7(true).dnsHandled(false).build(),
                PostureDetail.builder().path("b.yaml").kind("CiliumNetworkPolicy").hasL7(false).dnsHandled(true).build()));

        ValidationReport findings = new ValidationReport("a.yaml");
        findings.addError("metadata.name is required");
        findings.addWarning("No explicit DNS egress (add kube-dns:53 or toFQDNs)");

        Path output = dir.resolve("posture.xlsx");
        new PostureExcelReportGenerator().generateReport(checklist, List.of(findings), output.toString());

        try (InputStream in = Files.newInputStream(output);
             Workbook workbook = new XSSFWorkbook(in)) {
            assertEquals(3, workbook.getNumberOfSheets());

            Sheet summary = workbook.getSheet(PostureExcelReportGenerator.SHEET_SUMMARY);
            assertEquals("Total policies", summary.getRow(1).getCell(0).getStringCellValue());
            assertEquals(2.0, summary.getRow(1).getCell(1).getNumericCellValue());

            Sheet details = workbook.getSheet(PostureExcelReportGenerator.SHEET_DETAILS);
            assertEquals("STT", details.getRow(0).getCell(0).getStringCellValue());
            assertEquals("a.yaml", details.getRow(1).getCell(1).getStringCellValue());
            assertEquals(PostureExcelReportGenerator.YES, details.getRow(1).getCell(3).getStringCellValue());
            assertEquals(PostureExcelReportGenerator.NO, details.getRow(1).getCell(4).getStringCellValue());
            assertEquals(2, details.getLastRowNum());

            Sheet findingsSheet = workbook.getSheet(PostureExcelReportGenerator.SHEET_FINDINGS);
            assertEquals("ERROR", findingsSheet.getRow(1).getCell(2).getStringCellValue());
            assertEquals("WARNING", findingsSheet.getRow(2).getCell(2).getStringCellValue());
            assertEquals("2", findingsSheet.getRow(2).getCell(0).getStringCellValue());
        }
    }
}

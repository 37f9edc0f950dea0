package com.studygroups.studygroups_api.service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.studygroups.studygroups_api.dto.GroupMemberView;
import com.studygroups.studygroups_api.dto.GroupView;

/**
 * Writes the latest groups to an .xls workbook, one row per member.
 */
@Service
public class GroupExportService {

    private static final Logger logger = LoggerFactory.getLogger(GroupExportService.class);

    static final String[] COLUMNS = {"Course Code", "Course Name", "Group", "Member Name", "Email"};
    static final int HEADER_ROW = 2;

    private final GroupQueryService groupQueryService;

    public GroupExportService(GroupQueryService groupQueryService) {
        this.groupQueryService = groupQueryService;
    }

    public String getExcelFilename() {
        return String.format("StudyGroups_%s.xls", LocalDate.now());
    }

    public ByteArrayInputStream generateGroupsExcel() throws IOException {
        List<GroupView> groups = groupQueryService.getLatestGroups();
        if (groups.isEmpty()) {
            throw new IllegalArgumentException("No study groups found. Run matching first.");
        }
        logger.info("Generating Excel export for {} groups", groups.size());

        try (Workbook workbook = new HSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet("Study Groups");
            sheet.setDefaultColumnWidth(22);

            CellStyle headerStyle = createHeaderStyle(workbook);
            CellStyle groupStyle = createGroupStyle(workbook);
            CellStyle plainStyle = createPlainStyle(workbook);

            Row titleRow = sheet.createRow(0);
            Cell titleCell = titleRow.createCell(0);
            titleCell.setCellValue("Study Groups");
            titleCell.setCellStyle(createTitleStyle(workbook));
            sheet.addMergedRegion(new CellRangeAddress(0, 0, 0, COLUMNS.length - 1));

            Row headerRow = sheet.createRow(HEADER_ROW);
            for (int i = 0; i < COLUMNS.length; i++) {
                Cell cell = headerRow.createCell(i);
                cell.setCellValue(COLUMNS[i]);
                cell.setCellStyle(headerStyle);
            }

            int rowIdx = HEADER_ROW + 1;
            for (GroupView group : groups) {
                for (GroupMemberView member : group.members()) {
                    Row row = sheet.createRow(rowIdx++);
                    setCell(row, 0, group.courseCode(), groupStyle);
                    setCell(row, 1, group.courseName(), plainStyle);
                    Cell indexCell = row.createCell(2);
                    indexCell.setCellValue(group.groupIndex());
                    indexCell.setCellStyle(groupStyle);
                    setCell(row, 3, member.name(), plainStyle);
                    setCell(row, 4, member.email(), plainStyle);
                }
            }

            workbook.write(out);
            logger.info("Excel export generated with {} member rows", rowIdx - HEADER_ROW - 1);
            return new ByteArrayInputStream(out.toByteArray());
        } catch (IOException e) {
            logger.error("Error generating group Excel export: {}", e.getMessage());
            throw e;
        }
    }

    private void setCell(Row row, int column, String value, CellStyle style) {
        Cell cell = row.createCell(column);
        cell.setCellValue(value == null ? "" : value);
        cell.setCellStyle(style);
    }

    private CellStyle createTitleStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        font.setFontHeightInPoints((short) 14);
        style.setFont(font);
        style.setAlignment(HorizontalAlignment.CENTER);
        return style;
    }

    private CellStyle createHeaderStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        font.setColor(IndexedColors.WHITE.getIndex());
        style.setFont(font);
        style.setFillForegroundColor(IndexedColors.SEA_GREEN.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setAlignment(HorizontalAlignment.CENTER);
        style.setVerticalAlignment(VerticalAlignment.CENTER);
        setBorder(style, BorderStyle.THIN);
        return style;
    }

    private CellStyle createGroupStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        style.setFont(font);
        style.setAlignment(HorizontalAlignment.CENTER);
        setBorder(style, BorderStyle.THIN);
        return style;
    }

    private CellStyle createPlainStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        style.setVerticalAlignment(VerticalAlignment.TOP);
        setBorder(style, BorderStyle.THIN);
        return style;
    }

    private void setBorder(CellStyle style, BorderStyle borderStyle) {
        style.setBorderBottom(borderStyle);
        style.setBorderTop(borderStyle);
        style.setBorderLeft(borderStyle);
        style.setBorderRight(borderStyle);
    }
}

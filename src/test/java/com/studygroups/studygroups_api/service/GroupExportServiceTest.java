package com.studygroups.studygroups_api.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.util.List;

import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.studygroups.studygroups_api.dto.GroupMemberView;
import com.studygroups.studygroups_api.dto.GroupView;

@ExtendWith(MockitoExtension.class)
class GroupExportServiceTest {

    @Mock
    private GroupQueryService groupQueryService;

    @InjectMocks
    private GroupExportService groupExportService;

    @Test
    void writesOneRowPerMember() throws Exception {
        when(groupQueryService.getLatestGroups()).thenReturn(List.of(
                new GroupView("g1", "c1", "CS101", "Intro to Computer Science", 1, List.of(
                        new GroupMemberView("s1", "Adam", "adam@uni.edu"),
                        new GroupMemberView("s2", "Zoe", "zoe@uni.edu"))),
                new GroupView("g2", "c1", "CS101", "Intro to Computer Science", 2, List.of(
                        new GroupMemberView("s3", "Mia", "mia@uni.edu")))));

        ByteArrayInputStream bis = groupExportService.generateGroupsExcel();

        try (Workbook workbook = new HSSFWorkbook(bis)) {
            Sheet sheet = workbook.getSheet("Study Groups");
            assertThat(sheet).isNotNull();

            Row header = sheet.getRow(GroupExportService.HEADER_ROW);
            assertThat(header.getCell(0).getStringCellValue()).isEqualTo("Course Code");
            assertThat(header.getCell(4).getStringCellValue()).isEqualTo("Email");

            Row first = sheet.getRow(GroupExportService.HEADER_ROW + 1);
            assertThat(first.getCell(0).getStringCellValue()).isEqualTo("CS101");
            assertThat(first.getCell(2).getNumericCellValue()).isEqualTo(1.0);
            assertThat(first.getCell(3).getStringCellValue()).isEqualTo("Adam");

            Row last = sheet.getRow(GroupExportService.HEADER_ROW + 3);
            assertThat(last.getCell(2).getNumericCellValue()).isEqualTo(2.0);
            assertThat(last.getCell(4).getStringCellValue()).isEqualTo("mia@uni.edu");
            assertThat(sheet.getRow(GroupExportService.HEADER_ROW + 4)).isNull();
        }
    }

    @Test
    void refusesToExportWithoutGroups() {
        when(groupQueryService.getLatestGroups()).thenReturn(List.of());

        assertThatThrownBy(() -> groupExportService.generateGroupsExcel())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void filenameIsAnXlsFile() {
        assertThat(groupExportService.getExcelFilename()).startsWith("StudyGroups_").endsWith(".xls");
    }
}

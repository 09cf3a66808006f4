package com.example.brite.service;

import com.example.brite.constants.UploadColumns;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 가격 일괄 등록용 엑셀 읽기/템플릿 생성 서비스
 */
@Slf4j
@Service
public class ExcelService {

    private static final int MIN_COLUMN_WIDTH = 3000;
    private static final int MAX_COLUMN_WIDTH = 12000;

    /**
     * 첫 시트를 읽어 헤더명 → 셀 값 Map 리스트로 반환
     * 헤더 행은 제외하고, 모든 셀이 비어있는 행은 건너뜁니다.
     * 각 Map에는 엑셀 행 번호가 {@link UploadColumns#ROW_NUMBER} 키로 들어갑니다.
     *
     * @param inputStream xlsx 스트림
     * @param fileName    로그용 파일명
     */
    public List<Map<String, Object>> parseRows(InputStream inputStream, String fileName) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();

        try (Workbook workbook = new XSSFWorkbook(inputStream)) {
            Sheet sheet = workbook.getSheetAt(0);
            log.info("엑셀 파싱 시작: fileName={}, sheet={}, 마지막 행={}",
                    fileName, sheet.getSheetName(), sheet.getLastRowNum() + 1);

            Row headerRow = sheet.getRow(0);
            if (headerRow == null || sheet.getLastRowNum() < 1) {
                log.warn("엑셀 데이터 행 없음: fileName={}", fileName);
                return rows;
            }

            List<String> headers = new ArrayList<>();
            for (int i = 0; i < headerRow.getLastCellNum(); i++) {
                Object header = getCellValue(headerRow.getCell(i));
                headers.add(header != null ? header.toString().trim() : "");
            }
            log.debug("엑셀 헤더: {}", headers);

            for (int rowIndex = 1; rowIndex <= sheet.getLastRowNum(); rowIndex++) {
                Row row = sheet.getRow(rowIndex);
                if (row == null) {
                    continue;
                }

                Map<String, Object> rowData = new LinkedHashMap<>();
                boolean empty = true;
                for (int colIndex = 0; colIndex < headers.size(); colIndex++) {
                    String header = headers.get(colIndex);
                    if (header.isEmpty()) {
                        continue;
                    }
                    Object value = getCellValue(row.getCell(colIndex));
                    if (value instanceof String && ((String) value).isEmpty()) {
                        value = null;
                    }
                    if (value != null) {
                        empty = false;
                    }
                    rowData.put(header, value);
                }
                if (empty) {
                    continue;
                }

                rowData.put(UploadColumns.ROW_NUMBER, rowIndex + 1);
                rows.add(rowData);
            }
        }

        log.info("엑셀 파싱 완료: fileName={}, 데이터 행 {}개", fileName, rows.size());
        return rows;
    }

    /**
     * 셀 값 변환 (정수 숫자는 Long, 그 외 숫자는 Double)
     */
    private Object getCellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }

        switch (type) {
            case STRING:
                return cell.getStringCellValue().trim();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                double numericValue = cell.getNumericCellValue();
                if (numericValue == Math.floor(numericValue) && !Double.isInfinite(numericValue)) {
                    return (long) numericValue;
                }
                return numericValue;
            case BOOLEAN:
                return cell.getBooleanCellValue();
            default:
                return null;
        }
    }

    /**
     * 가격 일괄 등록 템플릿 생성 (헤더 + 샘플 1행)
     *
     * @return xlsx 바이트 배열
     */
    public byte[] createPriceUploadTemplate() throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {

            Sheet sheet = workbook.createSheet("prices");

            CellStyle headerStyle = workbook.createCellStyle();
            Font headerFont = workbook.createFont();
            headerFont.setBold(true);
            headerStyle.setFont(headerFont);
            headerStyle.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
            headerStyle.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            headerStyle.setBorderBottom(BorderStyle.THIN);
            headerStyle.setAlignment(HorizontalAlignment.CENTER);

            Row headerRow = sheet.createRow(0);
            for (int i = 0; i < UploadColumns.ALL.size(); i++) {
                Cell cell = headerRow.createCell(i);
                cell.setCellValue(UploadColumns.ALL.get(i));
                cell.setCellStyle(headerStyle);
            }

            // 샘플 행 (헤더 순서와 동일)
            Row sampleRow = sheet.createRow(1);
            sampleRow.createCell(0).setCellValue("Grace Kidney Beans");
            sampleRow.createCell(1).setCellValue("Red kidney beans in brine");
            sampleRow.createCell(2).setCellValue("Grace");
            sampleRow.createCell(3).setCellValue("400g");
            sampleRow.createCell(4).setCellValue("Canned Goods");
            sampleRow.createCell(5).setCellValue("grace-kidney-beans-400g");
            sampleRow.createCell(6).setCellValue("ChIJ-sample-place-id");
            sampleRow.createCell(7).setCellValue("Hi-Lo Food Stores");
            sampleRow.createCell(8).setCellValue("Kingston, Jamaica");
            sampleRow.createCell(9).setCellValue(18.0179);
            sampleRow.createCell(10).setCellValue(-76.8099);
            sampleRow.createCell(11).setCellValue(false);
            sampleRow.createCell(12).setCellValue(250);
            sampleRow.createCell(13).setCellValue("JMD");

            for (int i = 0; i < UploadColumns.ALL.size(); i++) {
                sheet.autoSizeColumn(i);
                int width = sheet.getColumnWidth(i);
                sheet.setColumnWidth(i, Math.max(MIN_COLUMN_WIDTH, Math.min(width, MAX_COLUMN_WIDTH)));
            }

            workbook.write(outputStream);
            byte[] bytes = outputStream.toByteArray();
            log.info("가격 업로드 템플릿 생성: {} bytes", bytes.length);
            return bytes;
        }
    }
}

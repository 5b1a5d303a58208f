package com.jobmatch.matcher.service.corpus;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.jobmatch.matcher.dto.corpus.CleanedPosting;
import com.jobmatch.matcher.dto.corpus.JobPosting;
import com.jobmatch.matcher.exception.InvalidCorpusException;
import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads and writes corpus tables. Raw corpora need a {@code Summary} column; other known columns
 * are optional and unknown ones are ignored. Cleaned tables add {@code cleaned_summary} and {@code
 * cluster}.
 */
@Slf4j
@Component
public class CorpusCsvCodec {

  public static final String URL = "Url";
  public static final String COMPANY = "Company";
  public static final String TITLE = "Title";
  public static final String LOCATION = "Location";
  public static final String PUBLICATION_DATE = "Publication Date";
  public static final String SUMMARY = "Summary";
  public static final String SUMMARY_FR = "Summary_fr";
  public static final String LEVEL = "Level";
  public static final String REGION = "Region";
  public static final String CLEANED_SUMMARY = "cleaned_summary";
  public static final String CLUSTER = "cluster";

  private static final String BYTE_ORDER_MARK = "\uFEFF";

  private static final String[] POSTING_COLUMNS = {
    URL, COMPANY, TITLE, LOCATION, PUBLICATION_DATE, SUMMARY, SUMMARY_FR, LEVEL, REGION
  };

  public List<JobPosting> readPostings(byte[] csv, String source) {
    List<JobPosting> postings = new ArrayList<>();
    for (Map<String, String> row : readRows(csv, source, SUMMARY)) {
      postings.add(toPosting(row));
    }
    return postings;
  }

  /** Reads a cleaned table back, in file order. */
  public List<CleanedPosting> readCleaned(byte[] csv, String source) {
    List<CleanedPosting> postings = new ArrayList<>();
    for (Map<String, String> row : readRows(csv, source, CLEANED_SUMMARY)) {
      postings.add(new CleanedPosting(toPosting(row), row.getOrDefault(CLEANED_SUMMARY, "")));
    }
    return postings;
  }

  public byte[] writeCleaned(List<CleanedPosting> postings, int[] labels) {
    if (labels.length != postings.size()) {
      throw new IllegalArgumentException(
          "Need one label per posting, got " + labels.length + " for " + postings.size());
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (CSVWriter writer =
        new CSVWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8))) {
      String[] header = new String[POSTING_COLUMNS.length + 2];
      System.arraycopy(POSTING_COLUMNS, 0, header, 0, POSTING_COLUMNS.length);
      header[POSTING_COLUMNS.length] = CLEANED_SUMMARY;
      header[POSTING_COLUMNS.length + 1] = CLUSTER;
      writer.writeNext(header);

      for (int i = 0; i < postings.size(); i++) {
        JobPosting p = postings.get(i).getPosting();
        writer.writeNext(
            new String[] {
              p.getUrl(),
              p.getCompany(),
              p.getTitle(),
              p.getLocation(),
              p.getPublicationDate(),
              p.getSummary(),
              p.getSummaryFr(),
              p.getLevel(),
              p.getRegion(),
              postings.get(i).getCleanedSummary(),
              Integer.toString(labels[i])
            });
      }
    } catch (IOException e) {
      throw new IllegalStateException("Failed to write corpus table", e);
    }
    return out.toByteArray();
  }

  /** Number of data rows, header excluded. */
  public int countRows(byte[] csv, String source) {
    return readRows(csv, source, null).size();
  }

  private List<Map<String, String>> readRows(byte[] csv, String source, String requiredColumn) {
    List<Map<String, String>> rows = new ArrayList<>();
    try (CSVReader reader =
        new CSVReader(
            new InputStreamReader(new ByteArrayInputStream(csv), StandardCharsets.UTF_8))) {
      String[] headers = reader.readNext();
      if (headers == null || headers.length == 0) {
        throw new InvalidCorpusException("Corpus " + source + " has no header row");
      }
      if (headers[0].startsWith(BYTE_ORDER_MARK)) {
        headers[0] = headers[0].substring(1);
      }
      Map<String, Integer> index = new HashMap<>();
      for (int i = 0; i < headers.length; i++) {
        index.putIfAbsent(headers[i].strip(), i);
      }
      if (requiredColumn != null && !index.containsKey(requiredColumn)) {
        throw new InvalidCorpusException(
            "'" + requiredColumn + "' column not found in corpus " + source);
      }

      String[] line;
      while ((line = reader.readNext()) != null) {
        if (line.length == 1 && line[0].isEmpty()) {
          continue;
        }
        Map<String, String> row = new HashMap<>();
        for (Map.Entry<String, Integer> column : index.entrySet()) {
          if (column.getValue() < line.length) {
            row.put(column.getKey(), line[column.getValue()]);
          }
        }
        rows.add(row);
      }
    } catch (IOException | CsvValidationException e) {
      throw new InvalidCorpusException("Corpus " + source + " is not readable CSV", e);
    }
    log.debug("Read {} rows from {}", rows.size(), source);
    return rows;
  }

  private static JobPosting toPosting(Map<String, String> row) {
    return JobPosting.builder()
        .url(emptyToNull(row.get(URL)))
        .company(emptyToNull(row.get(COMPANY)))
        .title(emptyToNull(row.get(TITLE)))
        .location(emptyToNull(row.get(LOCATION)))
        .publicationDate(emptyToNull(row.get(PUBLICATION_DATE)))
        .summary(emptyToNull(row.get(SUMMARY)))
        .summaryFr(emptyToNull(row.get(SUMMARY_FR)))
        .level(emptyToNull(row.get(LEVEL)))
        .region(emptyToNull(row.get(REGION)))
        .build();
  }

  private static String emptyToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }
}

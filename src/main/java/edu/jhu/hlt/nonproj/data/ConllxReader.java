package edu.jhu.hlt.nonproj.data;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.zip.GZIPInputStream;

import org.apache.log4j.Logger;

import edu.jhu.hlt.nonproj.datatypes.DepSentence;
import edu.jhu.hlt.nonproj.datatypes.DependencyParse;

/**
 * Reads CoNLL-X files: one word per line with 10 tab separated columns and a
 * blank line after every sentence. See http://ilk.uvt.nl/conll/#dataformat
 *
 * Columns used: FORM (1), LEMMA (2), CPOSTAG (3), HEAD (6), DEPREL (7). A "_"
 * lemma is replaced by the lowercased form. If any word in a sentence has a "_"
 * HEAD the sentence is read without a gold parse.
 *
 * Files ending in ".gz" are decompressed.
 *
 * @author travis
 */
public class ConllxReader implements Iterator<DepSentence>, AutoCloseable {
  public static final Logger LOG = Logger.getLogger(ConllxReader.class);

  private String source;
  private BufferedReader reader;
  private DepSentence next;
  private int sentencesRead;
  private int lineNumber;

  public ConllxReader(File f) throws IOException {
    this(f.getPath(), open(f));
  }

  /** r belongs to this reader from here on, it is closed even if the first sentence is bad */
  public ConllxReader(String source, Reader r) throws IOException {
    this.source = source;
    this.reader = r instanceof BufferedReader ? (BufferedReader) r : new BufferedReader(r);
    try {
      this.next = readASentence();
    } catch (IOException | RuntimeException e) {
      reader.close();
      throw e;
    }
  }

  private static Reader open(File f) throws IOException {
    InputStream is = new FileInputStream(f);
    if (f.getName().endsWith(".gz"))
      is = new GZIPInputStream(is);
    return new InputStreamReader(is, StandardCharsets.UTF_8);
  }

  public static List<DepSentence> readAll(File f) {
    List<DepSentence> all = new ArrayList<>();
    try (ConllxReader r = new ConllxReader(f)) {
      while (r.hasNext())
        all.add(r.next());
    } catch (IOException e) {
      throw new RuntimeException("failed to read " + f.getPath(), e);
    }
    LOG.info("read " + all.size() + " sentences from " + f.getPath());
    return all;
  }

  @Override
  public boolean hasNext() {
    return next != null;
  }

  @Override
  public DepSentence next() {
    if (next == null)
      throw new NoSuchElementException();
    DepSentence r = next;
    try {
      next = readASentence();
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    return r;
  }

  private DepSentence readASentence() throws IOException {
    List<String[]> rows = new ArrayList<>();
    for (String line = reader.readLine(); line != null; line = reader.readLine()) {
      lineNumber++;
      if (line.trim().isEmpty()) {
        if (rows.isEmpty())
          continue;   // extra blank lines
        break;
      }
      String[] cols = line.split("\t");
      if (cols.length < 8) {
        throw new IllegalArgumentException(source + ":" + lineNumber
            + " expected at least 8 columns but got " + cols.length + ": " + line);
      }
      rows.add(cols);
    }
    if (rows.isEmpty())
      return null;

    int n = rows.size();
    String[] forms = new String[n];
    String[] lemmas = new String[n];
    String[] pos = new String[n];
    boolean haveHeads = true;
    for (int i = 0; i < n; i++) {
      String[] r = rows.get(i);
      if (Integer.parseInt(r[0]) != i + 1) {
        throw new IllegalArgumentException(source + ": word " + (i + 1)
            + " of sentence " + sentencesRead + " has ID " + r[0]);
      }
      forms[i] = r[1];
      lemmas[i] = "_".equals(r[2]) ? r[1].toLowerCase() : r[2];
      pos[i] = r[3];
      haveHeads &= !"_".equals(r[6]);
    }
    DependencyParse gold = haveHeads ? DependencyParse.fromConllx(rows) : null;
    String id = source + "#" + sentencesRead;
    sentencesRead++;
    return new DepSentence(id, forms, lemmas, pos, gold);
  }

  public int getNumSentencesRead() {
    return sentencesRead;
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}

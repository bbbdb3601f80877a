package edu.jhu.hlt.nonproj.features;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import edu.jhu.hlt.nonproj.parse.DepArc;
import edu.jhu.hlt.nonproj.parse.DepToken;
import edu.jhu.hlt.nonproj.parse.ParseState;

/**
 * Feature templates over a {@link ParseState}, described by short strings so
 * that a feature set can live in a text file:
 * <pre>
 *   s0.form          form of the stack top
 *   i1.pos           POS of the token after the input token
 *   s-1.lemma        lemma of the first non-reduced token left of the stack top
 *   l2.pos           POS of the token at stack+2, reduced or not
 *   s0.lmd.label     label of the stack top's leftmost dependent
 *   i0.head.pos      POS of the input token's head
 *   s0.pos+i0.pos    conjunction
 *   dist             binned distance between stack top and input
 * </pre>
 * A location is one of s (stackToken), i (inputToken) or l (lambdaToken)
 * followed by an offset. It can be followed by any number of lmd, rmd or head
 * steps, and always ends with one of form, lemma, pos, label or hashead.
 *
 * Every template fires exactly one feature per state: tokens off the end of
 * the sentence produce the {@link DepToken#NULL} values.
 *
 * @author travis
 */
public class ParserFeatureTemplates {
  public static final Logger LOG = Logger.getLogger(ParserFeatureTemplates.class);

  public static final String DEFAULT_RESOURCE = "/parser-features.txt";

  /** A single named feature, value computed from the state */
  public interface Template extends FeatureGenerator {
    String getName();

    String value(ParseState state);

    @Override
    default Iterable<String> generate(ParseState state) {
      return Collections.singletonList(getName() + "=" + value(state));
    }
  }

  public enum Attribute {
    FORM, LEMMA, POS, LABEL, HASHEAD;
  }

  public enum Relation {
    LMD, RMD, HEAD;
  }

  /** Reads a token relative to the cursors, optionally follows arcs, then reads an attribute */
  public static class TokenTemplate implements Template {
    private final String name;
    private final char location;
    private final int offset;
    private final Relation[] path;
    private final Attribute attr;

    public TokenTemplate(String name, char location, int offset, Relation[] path, Attribute attr) {
      if (location != 's' && location != 'i' && location != 'l')
        throw new IllegalArgumentException("unknown location: " + location);
      this.name = name;
      this.location = location;
      this.offset = offset;
      this.path = path;
      this.attr = attr;
    }

    @Override
    public String getName() {
      return name;
    }

    public DepToken resolve(ParseState state) {
      DepToken t;
      if (location == 's')
        t = state.stackToken(offset);
      else if (location == 'i')
        t = state.inputToken(offset);
      else
        t = state.lambdaToken(offset);
      for (int i = 0; i < path.length && !t.isNull(); i++) {
        switch (path[i]) {
        case LMD:
          t = state.leftmostDependent(t.idx);
          break;
        case RMD:
          t = state.rightmostDependent(t.idx);
          break;
        case HEAD:
          t = state.headToken(t.idx);
          break;
        }
      }
      return t;
    }

    @Override
    public String value(ParseState state) {
      DepToken t = resolve(state);
      switch (attr) {
      case FORM:
        return t.form;
      case LEMMA:
        return t.lemma;
      case POS:
        return t.pos;
      case LABEL:
        if (t.isNull())
          return "<NULL>-l";
        DepArc a = state.getArc(t.idx);
        return a == null ? "<NONE>-l" : a.label;
      case HASHEAD:
        if (t.isNull())
          return "<NULL>-h";
        return state.hasHead(t.idx) ? "T" : "F";
      default:
        throw new RuntimeException("unknown attribute: " + attr);
      }
    }
  }

  /** Conjoins templates, e.g. "s0.pos+i0.pos=NN|VBZ" */
  public static class TemplateJoin implements Template {
    private final String name;
    private final Template[] pieces;

    public TemplateJoin(String name, Template[] pieces) {
      if (pieces.length < 2)
        throw new IllegalArgumentException("a join needs at least two pieces");
      this.name = name;
      this.pieces = pieces;
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public String value(ParseState state) {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < pieces.length; i++) {
        if (i > 0)
          sb.append('|');
        sb.append(pieces[i].value(state));
      }
      return sb.toString();
    }
  }

  /** input - stack, binned: 1, 2, 3, 4, 5-9, 10+ */
  public static class DistanceTemplate implements Template {
    @Override
    public String getName() {
      return "dist";
    }

    @Override
    public String value(ParseState state) {
      int d = state.getInput() - state.getStack();
      if (d < 5)
        return String.valueOf(d);
      if (d < 10)
        return "5-9";
      return "10+";
    }
  }

  public static Template parse(String description) {
    String desc = description.trim();
    if (desc.isEmpty())
      throw new IllegalArgumentException("empty template");
    if (desc.indexOf('+') >= 0) {
      String[] parts = desc.split("\\+");
      Template[] pieces = new Template[parts.length];
      for (int i = 0; i < parts.length; i++)
        pieces[i] = parse(parts[i]);
      return new TemplateJoin(desc, pieces);
    }
    if ("dist".equals(desc))
      return new DistanceTemplate();

    String[] steps = desc.split("\\.");
    if (steps.length < 2)
      throw new IllegalArgumentException("can't parse template: " + description);
    String loc = steps[0];
    if (loc.length() < 2)
      throw new IllegalArgumentException("bad location in template: " + description);
    int offset;
    try {
      offset = Integer.parseInt(loc.substring(1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("bad offset in template: " + description, e);
    }
    Relation[] path = new Relation[steps.length - 2];
    Attribute attr;
    try {
      for (int i = 0; i < path.length; i++)
        path[i] = Relation.valueOf(steps[i + 1].toUpperCase());
      attr = Attribute.valueOf(steps[steps.length - 1].toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("can't parse template: " + description, e);
    }
    return new TokenTemplate(desc, loc.charAt(0), offset, path, attr);
  }

  /** One template per line, blank lines and everything after '#' ignored */
  public static FeatureGenerator.Composite fromLines(Iterable<String> lines) {
    List<Template> templates = new ArrayList<>();
    for (String line : lines) {
      int c = line.indexOf('#');
      if (c >= 0)
        line = line.substring(0, c);
      line = line.trim();
      if (!line.isEmpty())
        templates.add(parse(line));
    }
    return new FeatureGenerator.Composite(templates);
  }

  public static FeatureGenerator.Composite fromFile(File f) {
    try {
      FeatureGenerator.Composite c = fromLines(Files.readAllLines(f.toPath(), StandardCharsets.UTF_8));
      LOG.info("loaded " + c.numPieces() + " feature templates from " + f.getPath());
      return c;
    } catch (IOException e) {
      throw new RuntimeException("couldn't read feature templates from " + f.getPath(), e);
    }
  }

  public static FeatureGenerator.Composite fromResource(String resource) {
    InputStream is = ParserFeatureTemplates.class.getResourceAsStream(resource);
    if (is == null)
      throw new IllegalArgumentException("no such resource: " + resource);
    List<String> lines = new ArrayList<>();
    try (Reader r = new InputStreamReader(is, StandardCharsets.UTF_8);
        BufferedReader br = new BufferedReader(r)) {
      for (String line = br.readLine(); line != null; line = br.readLine())
        lines.add(line);
    } catch (IOException e) {
      throw new RuntimeException("couldn't read " + resource, e);
    }
    FeatureGenerator.Composite c = fromLines(lines);
    LOG.info("loaded " + c.numPieces() + " feature templates from " + resource);
    return c;
  }

  /**
   * If the value is a file, read templates from it, otherwise treat it as a
   * classpath resource.
   */
  public static FeatureGenerator.Composite load(String fileOrResource) {
    File f = new File(fileOrResource);
    if (f.isFile())
      return fromFile(f);
    return fromResource(fileOrResource);
  }

  public static FeatureGenerator.Composite defaultTemplates() {
    return fromResource(DEFAULT_RESOURCE);
  }
}

package hex.dtree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;

/** Classification quality of a tree over a set of entities.
 *
 * Keeps the confusion table (actual x predicted counts) and derives per-label
 * precision, recall and F1 plus the overall accuracy. A ratio with a zero
 * denominator is reported as NaN: precision of a label that was never
 * predicted, recall of a label that never occurs. F1 is NaN when either input
 * is NaN and 0 when both are 0.
 */
public class Scores {
  final Table<String,String,Integer> _confusion = HashBasedTable.create();
  final Map<String,LabelScore> _labels = new LinkedHashMap<String,LabelScore>();
  int _correct, _total;

  /** Counts for a single label. */
  public static class LabelScore {
    final String _label;
    int _correct, _predicted, _actual;
    LabelScore(String label) { _label = label; }

    public String label()  { return _label; }
    public int correct()   { return _correct; }
    public int predicted() { return _predicted; }
    public int actual()    { return _actual; }
    public double precision() { return Utils.ratio(_correct, _predicted); }
    public double recall()    { return Utils.ratio(_correct, _actual); }
    public double f1() {
      double p = precision(), r = recall();
      if( Double.isNaN(p) || Double.isNaN(r) ) return Double.NaN;
      return p + r == 0 ? 0.0 : 2 * (p * r) / (p + r);
    }

    @Override public String toString() {
      return _label + ": prec=" + Utils.p3d(precision()) + "(" + _correct + "/" + _predicted + ")"
        + ", recl=" + Utils.p3d(recall()) + "(" + _correct + "/" + _actual + ")"
        + ", F=" + Utils.p3d(f1());
    }
  }

  private LabelScore score(String label) {
    LabelScore s = _labels.get(label);
    if( s == null ) _labels.put(label, s = new LabelScore(label));
    return s;
  }

  void add(String actual, String predicted) {
    score(actual)._actual++;
    score(predicted)._predicted++;
    if( actual.equals(predicted) ) {
      score(actual)._correct++;
      _correct++;
    }
    _total++;
    Integer c = _confusion.get(actual, predicted);
    _confusion.put(actual, predicted, c == null ? 1 : c + 1);
  }

  /** Score of the label, or null if the label was neither seen nor predicted. */
  public LabelScore get(String label) { return _labels.get(label); }

  public double precision(String label) { LabelScore s = _labels.get(label); return s == null ? Double.NaN : s.precision(); }
  public double recall(String label)    { LabelScore s = _labels.get(label); return s == null ? Double.NaN : s.recall(); }
  public double f1(String label)        { LabelScore s = _labels.get(label); return s == null ? Double.NaN : s.f1(); }

  /** All labels seen as actual or predicted, in the order first met. */
  public List<LabelScore> labels() { return Collections.unmodifiableList(new ArrayList<LabelScore>(_labels.values())); }

  public int correct() { return _correct; }
  public int total()   { return _total; }
  public double accuracy() { return Utils.ratio(_correct, _total); }

  /** Number of entities of class {@code actual} classified as {@code predicted}. */
  public int confusion(String actual, String predicted) {
    Integer c = _confusion.get(actual, predicted);
    return c == null ? 0 : c;
  }

  public Table<String,String,Integer> confusionTable() { return HashBasedTable.create(_confusion); }

  /** Text report: one line per label with at least one correct prediction,
   * then correct/total. */
  public String report() {
    StringBuilder sb = new StringBuilder();
    for( LabelScore s : _labels.values() )
      if( s._correct > 0 ) sb.append(s).append('\n');
    return sb.append(_correct).append('/').append(_total).append('\n').toString();
  }

  @Override public String toString() { return report(); }
}

package edu.jhu.hlt.nonproj.util;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Insertion ordered list which ignores repeated items.
 *
 * @author travis
 */
public class UniqList<T> {

  private Set<T> seen;
  private List<T> list;

  public UniqList() {
    seen = new HashSet<>();
    list = new ArrayList<>();
  }

  public boolean add(T t) {
    if (seen.add(t)) {
      list.add(t);
      return true;
    }
    return false;
  }

  public int size() {
    return list.size();
  }

  public List<T> getList() {
    return list;
  }
}

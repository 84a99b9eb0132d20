package org.eqlogic.expressions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 代表项中一个子项的位置：从根出发依次选择的参数下标（从 0 开始）。
 * 空路径即根位置。
 * 此类是不可变的。
 * @author Ayalyt
 */
public final class Position implements Comparable<Position> {

    public static final Position ROOT = new Position(Collections.emptyList());

    private final List<Integer> path;

    private final int hashCode;

    private Position(List<Integer> path) {
        this.path = Collections.unmodifiableList(path);
        this.hashCode = Objects.hash(this.path);
    }

    /**
     * 工厂方法：由参数下标序列创建位置。
     * @param indices 每一层选择的参数下标，必须非负。
     * @return Position 实例，空序列返回 {@link #ROOT}。
     */
    public static Position of(int... indices) {
        if (indices.length == 0) {
            return ROOT;
        }
        List<Integer> path = new ArrayList<>(indices.length);
        for (int index : indices) {
            if (index < 0) {
                throw new IllegalArgumentException("位置下标不能为负数: " + Arrays.toString(indices));
            }
            path.add(index);
        }
        return new Position(path);
    }

    public static Position of(List<Integer> indices) {
        return of(indices.stream().mapToInt(Integer::intValue).toArray());
    }

    public boolean isRoot() {
        return path.isEmpty();
    }

    public int depth() {
        return path.size();
    }

    public int indexAt(int level) {
        return path.get(level);
    }

    public List<Integer> getPath() {
        return path;
    }

    /**
     * @return 去掉第一层下标后的位置。
     */
    public Position tail() {
        if (path.isEmpty()) {
            throw new IllegalStateException("根位置没有 tail");
        }
        return path.size() == 1 ? ROOT : new Position(new ArrayList<>(path.subList(1, path.size())));
    }

    /**
     * @return 在此位置前面加上一层下标 index 后的位置，即从父项看到的同一子项。
     */
    public Position under(int index) {
        List<Integer> newPath = new ArrayList<>(path.size() + 1);
        newPath.add(index);
        newPath.addAll(path);
        return new Position(newPath);
    }

    /**
     * @return 此位置的第 index 个子位置。
     */
    public Position child(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("位置下标不能为负数: " + index);
        }
        List<Integer> newPath = new ArrayList<>(path);
        newPath.add(index);
        return new Position(newPath);
    }

    public boolean isPrefixOf(Position other) {
        return other.path.size() >= path.size() && other.path.subList(0, path.size()).equals(path);
    }

    @Override
    public int compareTo(Position other) {
        int common = Math.min(path.size(), other.path.size());
        for (int i = 0; i < common; i++) {
            int cmp = Integer.compare(path.get(i), other.path.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(path.size(), other.path.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return path.equals(((Position) o).path);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (path.isEmpty()) {
            return "ε";
        }
        return path.stream().map(String::valueOf).collect(Collectors.joining("."));
    }
}

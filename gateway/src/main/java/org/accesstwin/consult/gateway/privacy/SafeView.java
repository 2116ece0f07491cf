package org.accesstwin.consult.gateway.privacy;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;

/**
 * Coarse summary of a record that is safe to show a lower-trust consumer.
 *
 * <p>Holds only counts, controlled-vocabulary tags, rounded averages, generalized
 * themes and a first name. Never free text from the record.
 */
public final class SafeView {

    private final String firstNameOnly;
    private final List<String> supportCategories;
    private final SortedMap<String, Integer> categoryCounts;
    private final List<String> strengthThemes;
    private final List<String> goalThemes;
    private final int activeSupportCount;
    private final List<String> udlPrinciples;
    private final List<String> pourPrinciples;
    private final SortedMap<String, Double> effectivenessByCategory;

    SafeView(String firstNameOnly,
             List<String> supportCategories,
             SortedMap<String, Integer> categoryCounts,
             List<String> strengthThemes,
             List<String> goalThemes,
             int activeSupportCount,
             List<String> udlPrinciples,
             List<String> pourPrinciples,
             SortedMap<String, Double> effectivenessByCategory) {
        this.firstNameOnly = firstNameOnly;
        this.supportCategories = Collections.unmodifiableList(supportCategories);
        this.categoryCounts = Collections.unmodifiableSortedMap(categoryCounts);
        this.strengthThemes = Collections.unmodifiableList(strengthThemes);
        this.goalThemes = Collections.unmodifiableList(goalThemes);
        this.activeSupportCount = activeSupportCount;
        this.udlPrinciples = Collections.unmodifiableList(udlPrinciples);
        this.pourPrinciples = Collections.unmodifiableList(pourPrinciples);
        this.effectivenessByCategory = Collections.unmodifiableSortedMap(effectivenessByCategory);
    }

    public String getFirstNameOnly() {
        return firstNameOnly;
    }

    public List<String> getSupportCategories() {
        return supportCategories;
    }

    public SortedMap<String, Integer> getCategoryCounts() {
        return categoryCounts;
    }

    public List<String> getStrengthThemes() {
        return strengthThemes;
    }

    public List<String> getGoalThemes() {
        return goalThemes;
    }

    public int getActiveSupportCount() {
        return activeSupportCount;
    }

    public List<String> getUdlPrinciples() {
        return udlPrinciples;
    }

    public List<String> getPourPrinciples() {
        return pourPrinciples;
    }

    /**
     * Average rating per category over entries rated 1-5, to one decimal. Categories
     * without a usable rating are absent.
     */
    public SortedMap<String, Double> getEffectivenessByCategory() {
        return effectivenessByCategory;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SafeView that = (SafeView) o;
        return activeSupportCount == that.activeSupportCount &&
                Objects.equals(firstNameOnly, that.firstNameOnly) &&
                Objects.equals(supportCategories, that.supportCategories) &&
                Objects.equals(categoryCounts, that.categoryCounts) &&
                Objects.equals(strengthThemes, that.strengthThemes) &&
                Objects.equals(goalThemes, that.goalThemes) &&
                Objects.equals(udlPrinciples, that.udlPrinciples) &&
                Objects.equals(pourPrinciples, that.pourPrinciples) &&
                Objects.equals(effectivenessByCategory, that.effectivenessByCategory);
    }

    @Override
    public int hashCode() {
        return Objects.hash(firstNameOnly, supportCategories, categoryCounts, strengthThemes, goalThemes,
                activeSupportCount, udlPrinciples, pourPrinciples, effectivenessByCategory);
    }

    @Override
    public String toString() {
        return "SafeView{" +
                "firstNameOnly='" + firstNameOnly + '\'' +
                ", supportCategories=" + supportCategories +
                ", categoryCounts=" + categoryCounts +
                ", strengthThemes=" + strengthThemes +
                ", goalThemes=" + goalThemes +
                ", activeSupportCount=" + activeSupportCount +
                ", udlPrinciples=" + udlPrinciples +
                ", pourPrinciples=" + pourPrinciples +
                ", effectivenessByCategory=" + effectivenessByCategory +
                '}';
    }
}

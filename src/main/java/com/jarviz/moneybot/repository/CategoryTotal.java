package com.jarviz.moneybot.repository;

/**
 * Sum of amounts for one category.
 */
public interface CategoryTotal {

    String getCategory();

    Double getTotal();
}

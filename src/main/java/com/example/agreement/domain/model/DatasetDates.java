package com.example.agreement.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Date container of a dataset's metadata record. Every accessor returns an ordered, possibly empty list.
 */
public interface DatasetDates {

    /**
     * Date rendered when a dataset carries no date of the requested kind.
     */
    LocalDate DEFAULT_DATE = LocalDate.EPOCH;

    /**
     * @return dates on which the dataset was submitted, in record order
     */
    List<LocalDate> getDateSubmitted();

    /**
     * @return dates from which the dataset is available
     */
    List<LocalDate> getAvailable();
}

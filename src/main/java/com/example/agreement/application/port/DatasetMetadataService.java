package com.example.agreement.application.port;

import com.example.agreement.domain.model.DatasetRecord;

/**
 * Handle on the repository that stores dataset metadata.
 */
@FunctionalInterface
public interface DatasetMetadataService {

	/**
	 * Fetches the metadata and file list of a dataset.
	 *
	 * @param datasetId repository identifier of the dataset
	 * @return dataset record or {@code null} when the repository does not know the dataset
	 */
    DatasetRecord fetchDataset(String datasetId);
}

package com.bank.bakeoff.service;

import com.bank.bakeoff.engine.features.SchemaInferrer;
import com.bank.bakeoff.exception.NotFoundException;
import com.bank.bakeoff.exception.ValidationException;
import com.bank.bakeoff.model.ColumnSchema;
import com.bank.bakeoff.model.Dataset;
import com.bank.bakeoff.model.TabularData;
import com.bank.bakeoff.repository.DatasetRepository;
import com.bank.bakeoff.storage.BlobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Service
public class DatasetService {

    private static final Logger log = LoggerFactory.getLogger(DatasetService.class);

    private final DatasetRepository datasetRepository;
    private final CsvParsingService csvParsingService;
    private final BlobStore blobStore;

    public DatasetService(DatasetRepository datasetRepository,
                          CsvParsingService csvParsingService,
                          BlobStore blobStore) {
        this.datasetRepository = datasetRepository;
        this.csvParsingService = csvParsingService;
        this.blobStore = blobStore;
    }

    /**
     * Parse an uploaded file, infer its schema and store both the file and the record.
     *
     * @param fileName original file name; its extension decides the source format
     */
    public Dataset register(String name, String fileName, byte[] content) {
        if (content == null || content.length == 0) {
            throw new ValidationException("Uploaded file is empty");
        }
        String sourceFormat = extension(fileName);
        TabularData data = csvParsingService.parse(content, sourceFormat);
        if (data.size() == 0) {
            throw new ValidationException("CSV file contains no data");
        }

        List<ColumnSchema> schema = SchemaInferrer.infer(data);
        String labelColumn = SchemaInferrer.detectLabelColumn(data.getHeaders());

        String id = UUID.randomUUID().toString();
        String blobUrl = blobStore.upload("datasets/" + id + "/" + sanitize(fileName), content);

        Dataset dataset = Dataset.builder()
                .id(id)
                .name(name != null && !name.isBlank() ? name : baseName(fileName))
                .sourceFormat(sourceFormat)
                .blobUrl(blobUrl)
                .schema(schema)
                .rowCount(data.size())
                .labelPresent(labelColumn != null)
                .labelColumn(labelColumn)
                .createdAt(System.currentTimeMillis())
                .build();
        datasetRepository.save(dataset);

        log.info("Registered dataset {} ({}): {} rows, {} columns, label={}",
                id, dataset.getName(), data.size(), schema.size(), labelColumn);
        return dataset;
    }

    public Dataset getDataset(String datasetId) {
        Dataset dataset = datasetRepository.findById(datasetId);
        if (dataset == null) {
            throw NotFoundException.of("Dataset", datasetId);
        }
        return dataset;
    }

    public List<Dataset> listDatasets() {
        return datasetRepository.findAll();
    }

    public TabularData loadRows(Dataset dataset) {
        byte[] content = blobStore.download(dataset.getBlobUrl());
        return csvParsingService.parse(content, dataset.getSourceFormat());
    }

    private static String extension(String fileName) {
        if (fileName == null) return "csv";
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "csv";
    }

    private static String baseName(String fileName) {
        if (fileName == null || fileName.isEmpty()) return "unnamed_dataset";
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static String sanitize(String fileName) {
        if (fileName == null || fileName.isBlank()) return "data.csv";
        return fileName.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}

package com.starscape.mediaindex.features.indexing.api.dto;

import com.starscape.mediaindex.features.indexing.domain.FileView;
import com.starscape.mediaindex.features.library.domain.Photo;
import com.starscape.mediaindex.features.library.domain.PhotoFile;

/**
 * Response DTO for a single indexed file. {@code photo} is present only when requested.
 */
public record FileResponse(
    String fileUid,
    String photoUid,
    String root,
    String name,
    String hash,
    long size,
    String type,
    int width,
    int height,
    boolean video,
    boolean primary,
    boolean missing,
    String error,
    long modTime,
    PhotoSummary photo
) {
    
    public record PhotoSummary(String photoUid, String path, String title, boolean privateFlag, boolean archived) {
        static PhotoSummary from(Photo photo) {
            return new PhotoSummary(photo.getPhotoUid(), photo.getPhotoPath(), photo.getPhotoTitle(),
                photo.isPhotoPrivate(), photo.isArchived());
        }
    }
    
    public static FileResponse from(FileView view) {
        PhotoFile f = view.file();
        return new FileResponse(
            f.getFileUid(),
            f.getPhotoUid(),
            f.getFileRoot(),
            f.getFileName(),
            f.getFileHash(),
            f.getFileSize(),
            f.getFileType(),
            f.getFileWidth(),
            f.getFileHeight(),
            f.isFileVideo(),
            f.isFilePrimary(),
            f.isFileMissing(),
            f.getFileError(),
            f.getModTime(),
            view.optionalPhoto().map(PhotoSummary::from).orElse(null)
        );
    }
}

package com.easyinstall.backup.utils;

public class AppConstants {

    public static final String BACKUP_COMPLETED_STATUS = "completed";

    public static final String JOB_ACTIVE_STATUS = "active";
    public static final String JOB_INACTIVE_STATUS = "inactive";
    public static final String JOB_DELETED_STATUS = "deleted";

    public static final int DEFAULT_RETENTION_DAYS = 30;

    public static final String TIMESTAMP_PATTERN = "yyyyMMdd-HHmmss";
    public static final String ARTIFACT_PREFIX = "backup-";
    public static final String ARTIFACT_SUFFIX = ".tar.gz";

    public static final String OPERATOR_HEADER = "X-Operator-Id";

    public static final String MDC_OPERATION_ID = "operationId";
    public static final String MDC_JOB_ID = "jobId";

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    // s3 credential and destination keys
    public static final String ACCESS_KEY = "access_key";
    public static final String SECRET_KEY = "secret_key";
    public static final String REGION = "region";
    public static final String BUCKET = "bucket";
    public static final String PREFIX = "prefix";

    // drive credential and destination keys
    public static final String TOKEN = "token";
    public static final String REFRESH_TOKEN = "refresh_token";
    public static final String TOKEN_URI = "token_uri";
    public static final String CLIENT_ID = "client_id";
    public static final String CLIENT_SECRET = "client_secret";
    public static final String SCOPES = "scopes";
    public static final String FOLDER_ID = "folder_id";
    public static final String GOOGLE_TOKEN_URI = "https://oauth2.googleapis.com/token";
    public static final String DRIVE_FILE_SCOPE = "https://www.googleapis.com/auth/drive.file";

    // rclone credential and destination keys
    public static final String REMOTE = "remote";
    public static final String PATH = "path";
    public static final String TYPE = "type";
    public static final String DEFAULT_RCLONE_TYPE = "drive";

    public static final String NAME = "name";
    public static final String DEFAULT = "default";
}
